package com.proxylens.normalization.parsers;

import com.proxylens.normalization.LogDialect;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for key=value token streams such as
 * {@code time="2024-05-01 10:00:00" user=alice@corp.com src=10.0.0.5 action=blocked}.
 * Values may be double quoted; quoted values may contain spaces and escaped quotes.
 */
public class KeyValueParser implements EventParser {

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
        "([A-Za-z_][\\w.\\-]*)=(\"((?:[^\"\\\\]|\\\\.)*)\"|'([^']*)'|(\\S*))"
    );

    private static final int MIN_TOKENS = 2;

    @Override
    public Map<String, String> tokenize(String line) throws ParseException {
        Map<String, String> fields = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        Matcher matcher = TOKEN_PATTERN.matcher(line);
        int tokens = 0;
        while (matcher.find()) {
            tokens++;
            String value;
            if (matcher.group(3) != null) {
                value = matcher.group(3).replace("\\\"", "\"");
            } else if (matcher.group(4) != null) {
                value = matcher.group(4);
            } else {
                value = matcher.group(5);
            }
            if (!value.isEmpty()) {
                fields.put(matcher.group(1), value);
            }
        }

        if (tokens < MIN_TOKENS) {
            throw new ParseException("Expected at least " + MIN_TOKENS + " key=value tokens, found " + tokens,
                getDialect().getValue(), line);
        }
        return fields;
    }

    @Override
    public LogDialect getDialect() {
        return LogDialect.KEY_VALUE;
    }
}
