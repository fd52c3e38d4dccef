package com.proxylens.normalization.parsers;

import com.proxylens.normalization.LogDialect;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for Common Event Format (CEF).
 * Format: [syslog header] CEF:Version|Device Vendor|Device Product|Device Version|Signature ID|Name|Severity|Extension
 *
 * Header fields are exposed as devicevendor, deviceproduct, deviceversion,
 * signatureid, name and severity. Extension keys override header keys.
 */
public class CefParser implements EventParser {

    // CEF header pattern
    private static final Pattern CEF_PATTERN = Pattern.compile(
        "CEF:(\\d+)\\|([^|]*)\\|([^|]*)\\|([^|]*)\\|([^|]*)\\|([^|]*)\\|([^|]*)\\|(.*)"
    );

    // Extension key-value pattern
    private static final Pattern EXTENSION_PATTERN = Pattern.compile(
        "(\\w+)=(.*?)(?=\\s+\\w+=|$)"
    );

    @Override
    public Map<String, String> tokenize(String line) throws ParseException {
        int start = line.indexOf("CEF:");
        if (start < 0) {
            throw new ParseException("Missing CEF header", getDialect().getValue(), line);
        }

        Matcher matcher = CEF_PATTERN.matcher(line.substring(start).trim());
        if (!matcher.matches()) {
            throw new ParseException("Invalid CEF header", getDialect().getValue(), line);
        }

        Map<String, String> fields = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        fields.put("cefversion", matcher.group(1));
        fields.put("devicevendor", matcher.group(2));
        fields.put("deviceproduct", matcher.group(3));
        fields.put("deviceversion", matcher.group(4));
        fields.put("signatureid", matcher.group(5));
        fields.put("name", matcher.group(6));
        fields.put("severity", matcher.group(7));

        fields.putAll(parseExtensions(matcher.group(8)));
        return fields;
    }

    @Override
    public LogDialect getDialect() {
        return LogDialect.CEF;
    }

    /**
     * Parse CEF extension key-value pairs, unescaping \= and \\
     */
    private Map<String, String> parseExtensions(String extension) {
        Map<String, String> extensions = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        Matcher matcher = EXTENSION_PATTERN.matcher(extension.trim());
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = matcher.group(2).trim()
                .replace("\\=", "=")
                .replace("\\\\", "\\");
            if (!value.isEmpty()) {
                extensions.put(key, value);
            }
        }

        return extensions;
    }
}
