package com.proxylens.normalization.parsers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxylens.normalization.LogDialect;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parser for single-line JSON objects.
 *
 * Scalar fields are kept under their own name. Nested objects are flattened with
 * dotted keys, and each nested leaf is also reachable by its bare name unless a
 * top-level field already uses it. Arrays are kept as their JSON text.
 */
public class JsonEventParser implements EventParser {

    protected final ObjectMapper objectMapper;

    public JsonEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, String> tokenize(String line) throws ParseException {
        JsonNode root = readObject(line);
        Map<String, String> fields = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        flatten(root, "", fields);
        return fields;
    }

    @Override
    public LogDialect getDialect() {
        return LogDialect.JSON;
    }

    /**
     * Reads the line as a JSON object or fails with a ParseException
     */
    protected JsonNode readObject(String line) {
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ParseException("Malformed JSON: " + e.getOriginalMessage(), e,
                getDialect().getValue(), line);
        }
        if (root == null || !root.isObject()) {
            throw new ParseException("JSON line is not an object", getDialect().getValue(), line);
        }
        return root;
    }

    protected void flatten(JsonNode node, String prefix, Map<String, String> fields) {
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            JsonNode value = entry.getValue();

            if (value.isObject()) {
                flatten(value, key, fields);
            } else if (value.isNull()) {
                continue;
            } else {
                String text = value.isValueNode() ? value.asText() : value.toString();
                fields.put(key, text);
                if (!prefix.isEmpty()) {
                    fields.putIfAbsent(entry.getKey(), text);
                }
            }
        }
    }
}
