package com.proxylens.normalization.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxylens.normalization.LogDialect;

import java.util.Map;
import java.util.TreeMap;

/**
 * Parser for the Zscaler NSS web log JSON feed.
 * Format: {"sourcetype":"zscalernss-web","event":{"datetime":"...","user":"...",...}}
 * Fields of the "event" object win over envelope fields with the same name.
 * Objects without a top-level "event" object are read as plain JSON.
 */
public class ZscalerJsonParser extends JsonEventParser {

    public static final String DEFAULT_VENDOR = "Zscaler";

    public ZscalerJsonParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public Map<String, String> tokenize(String line) throws ParseException {
        JsonNode root = readObject(line);
        JsonNode event = root.get("event");
        Map<String, String> fields = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (event == null || !event.isObject()) {
            // Nested "event" key only, not an NSS envelope
            flatten(root, "", fields);
            return fields;
        }

        flatten(event, "", fields);

        // Envelope metadata (sourcetype, vendor) only fills gaps
        root.fields().forEachRemaining(entry -> {
            if (!"event".equals(entry.getKey()) && entry.getValue().isValueNode()
                    && !entry.getValue().isNull()) {
                fields.putIfAbsent(entry.getKey(), entry.getValue().asText());
            }
        });
        fields.putIfAbsent("vendor", DEFAULT_VENDOR);
        return fields;
    }

    @Override
    public LogDialect getDialect() {
        return LogDialect.ZSCALER_JSON;
    }
}
