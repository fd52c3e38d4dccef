package com.proxylens.normalization.parsers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxylens.normalization.LogDialect;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of parsers by dialect.
 * {@link LogDialect#UNKNOWN} has no parser: a line of unknown dialect is a parse failure.
 */
@Component
public class ParserRegistry {

    private final Map<LogDialect, EventParser> parsers = new EnumMap<>(LogDialect.class);
    private final ObjectMapper objectMapper;

    public ParserRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void registerParsers() {
        registerParser(new ZscalerJsonParser(objectMapper));
        registerParser(new JsonEventParser(objectMapper));
        registerParser(new CefParser());
        registerParser(new KeyValueParser());
    }

    /**
     * Gets the parser for the specified dialect
     *
     * @param dialect the detected dialect
     * @return the parser for that dialect
     * @throws ParseException if no parser handles the dialect
     */
    public EventParser getParser(LogDialect dialect, String line) throws ParseException {
        EventParser parser = parsers.get(dialect);
        if (parser == null) {
            throw new ParseException("Unrecognized log dialect", dialect.getValue(), line);
        }
        return parser;
    }

    /**
     * Registers a parser under the dialect it reports
     */
    public void registerParser(EventParser parser) {
        parsers.put(parser.getDialect(), parser);
    }
}
