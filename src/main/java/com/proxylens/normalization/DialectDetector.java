package com.proxylens.normalization;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects the dialect of a raw log line using cheap heuristics.
 * Detection never fails: lines matching no heuristic are {@link LogDialect#UNKNOWN}.
 */
@Component
public class DialectDetector {

    private static final Pattern ZSCALER_EVENT_KEY = Pattern.compile("\"event\"\\s*:\\s*\\{");

    private static final Pattern KEY_VALUE_TOKEN = Pattern.compile("(?:^|\\s)[A-Za-z_][\\w.\\-]*=");

    private static final int MIN_KEY_VALUE_TOKENS = 2;

    /**
     * Detect the dialect of a single line
     */
    public LogDialect detect(String line) {
        if (line == null) {
            return LogDialect.UNKNOWN;
        }

        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return LogDialect.UNKNOWN;
        }

        // JSON objects, with the Zscaler NSS envelope checked first
        if (trimmed.startsWith("{")) {
            if (ZSCALER_EVENT_KEY.matcher(trimmed).find()) {
                return LogDialect.ZSCALER_JSON;
            }
            return LogDialect.JSON;
        }

        // CEF may sit behind a syslog header
        if (trimmed.contains("CEF:")) {
            return LogDialect.CEF;
        }

        if (countKeyValueTokens(trimmed) >= MIN_KEY_VALUE_TOKENS) {
            return LogDialect.KEY_VALUE;
        }

        return LogDialect.UNKNOWN;
    }

    private int countKeyValueTokens(String line) {
        Matcher matcher = KEY_VALUE_TOKEN.matcher(line);
        int count = 0;
        while (matcher.find() && count < MIN_KEY_VALUE_TOKENS) {
            count++;
        }
        return count;
    }
}
