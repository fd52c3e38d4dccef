package com.proxylens.normalization;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.net.InetAddresses;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Value coercion rules shared by every dialect.
 *
 * All methods are lenient: a value that cannot be coerced yields null and never
 * fails the line.
 */
public final class FieldValues {

    public static final String BLOCKED = "Blocked";
    public static final String ALLOWED = "Allowed";

    private static final Set<String> NULL_MARKERS = ImmutableSet.of(
        "", "-", "none", "null", "n/a", "na", "nan", "undefined", "unknown");

    private static final Pattern EPOCH_SECONDS = Pattern.compile("\\d{9,10}(\\.\\d+)?");
    private static final Pattern EPOCH_MILLIS = Pattern.compile("\\d{12,13}");
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+(\\.0+)?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Accepted timestamp formats, tried in order
     */
    private static final List<Function<String, Instant>> TIMESTAMP_FORMATS = ImmutableList.of(
        text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
        text -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
        utc("yyyy-MM-dd HH:mm:ss[.SSS]"),
        utc("EEE MMM d HH:mm:ss yyyy"),
        text -> ZonedDateTime.parse(text,
            DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH)).toInstant(),
        utc("MMM d yyyy HH:mm:ss"),
        utc("yyyy/MM/dd HH:mm:ss")
    );

    private static final Map<String, String> ACTION_VOCABULARY = ImmutableMap.<String, String>builder()
        .put("blocked", BLOCKED)
        .put("block", BLOCKED)
        .put("deny", BLOCKED)
        .put("denied", BLOCKED)
        .put("drop", BLOCKED)
        .put("dropped", BLOCKED)
        .put("reject", BLOCKED)
        .put("rejected", BLOCKED)
        .put("quarantine", BLOCKED)
        .put("allowed", ALLOWED)
        .put("allow", ALLOWED)
        .put("permit", ALLOWED)
        .put("permitted", ALLOWED)
        .put("pass", ALLOWED)
        .put("accept", ALLOWED)
        .put("accepted", ALLOWED)
        .put("observed", ALLOWED)
        .put("caution", "Caution")
        .put("warn", "Caution")
        .put("isolate", "Isolated")
        .build();

    private static final Map<String, String> SEVERITY_VOCABULARY = ImmutableMap.<String, String>builder()
        .put("critical", "Critical")
        .put("critical risk", "Critical")
        .put("crit", "Critical")
        .put("very high", "Critical")
        .put("high", "High")
        .put("high risk", "High")
        .put("major", "High")
        .put("error", "High")
        .put("medium", "Medium")
        .put("medium risk", "Medium")
        .put("moderate", "Medium")
        .put("warning", "Medium")
        .put("warn", "Medium")
        .put("low", "Low")
        .put("low risk", "Low")
        .put("minor", "Low")
        .put("info", "Info")
        .put("informational", "Info")
        .put("notice", "Info")
        .build();

    private static final Map<String, String> THREAT_CATEGORY_VOCABULARY = ImmutableMap.<String, String>builder()
        .put("malware", "Malware")
        .put("virus", "Malware")
        .put("ransomware", "Ransomware")
        .put("botnet", "Botnet Callback")
        .put("botnet callback", "Botnet Callback")
        .put("c2", "Command and Control")
        .put("c&c", "Command and Control")
        .put("command and control", "Command and Control")
        .put("command & control", "Command and Control")
        .put("phishing", "Phishing")
        .put("phish", "Phishing")
        .put("suspected phishing", "Phishing")
        .put("cryptomining", "Cryptomining")
        .put("crypto mining", "Cryptomining")
        .put("coinminer", "Cryptomining")
        .put("data leakage", "Data Leakage")
        .put("dlp", "Data Leakage")
        .put("data transfer", "Data Transfer")
        .put("spyware", "Spyware")
        .put("adware/spyware", "Adware/Spyware")
        .put("browser exploit", "Browser Exploit")
        .put("dns tunneling", "DNS Tunneling")
        .put("suspicious content", "Suspicious Content")
        .build();

    private FieldValues() {
    }

    /**
     * Trims the value and maps null markers such as "None", "N/A" or "-" to null
     */
    public static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return NULL_MARKERS.contains(trimmed.toLowerCase(Locale.ROOT)) ? null : trimmed;
    }

    /**
     * Parses a timestamp using the accepted formats in order, epoch values included.
     * Zoneless values are read as UTC.
     */
    public static Instant parseTimestamp(String value) {
        String text = clean(value);
        if (text == null) {
            return null;
        }

        if (EPOCH_MILLIS.matcher(text).matches()) {
            return Instant.ofEpochMilli(Long.parseLong(text));
        }
        if (EPOCH_SECONDS.matcher(text).matches()) {
            double seconds = Double.parseDouble(text);
            return Instant.ofEpochMilli(Math.round(seconds * 1000));
        }

        String collapsed = WHITESPACE.matcher(text).replaceAll(" ");
        for (Function<String, Instant> format : TIMESTAMP_FORMATS) {
            Instant parsed = tryParse(format, collapsed);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    /**
     * Returns the canonical text form of an IPv4/IPv6 literal, or null when invalid
     */
    public static String normalizeIp(String value) {
        String text = clean(value);
        if (text == null) {
            return null;
        }
        if (text.startsWith("[") && text.endsWith("]")) {
            text = text.substring(1, text.length() - 1);
        }
        if (!InetAddresses.isInetAddress(text)) {
            return null;
        }
        return InetAddresses.toAddrString(InetAddresses.forString(text));
    }

    public static String normalizeAction(String value) {
        return mapVocabulary(value, ACTION_VOCABULARY);
    }

    /**
     * Maps textual severities onto Critical/High/Medium/Low/Info. Numeric CEF
     * severities (0-10) are bucketed as well.
     */
    public static String normalizeSeverity(String value) {
        String text = clean(value);
        if (text == null) {
            return null;
        }
        if (INTEGER.matcher(text).matches()) {
            int level = (int) Double.parseDouble(text);
            if (level >= 9) return "Critical";
            if (level >= 7) return "High";
            if (level >= 4) return "Medium";
            if (level >= 1) return "Low";
            return "Info";
        }
        return mapVocabulary(text, SEVERITY_VOCABULARY);
    }

    public static String normalizeThreatCategory(String value) {
        return mapVocabulary(value, THREAT_CATEGORY_VOCABULARY);
    }

    /**
     * Parses an integral value; a zero fraction is accepted, out-of-range values yield null
     */
    public static Integer parseInteger(String value) {
        String digits = integralDigits(value);
        return digits == null ? null : Ints.tryParse(digits);
    }

    public static Long parseLong(String value) {
        String digits = integralDigits(value);
        return digits == null ? null : Longs.tryParse(digits);
    }

    private static String integralDigits(String value) {
        String text = clean(value);
        if (text == null || !INTEGER.matcher(text).matches()) {
            return null;
        }
        int fraction = text.indexOf('.');
        if (fraction >= 0) {
            text = text.substring(0, fraction);
        }
        return text.startsWith("+") ? text.substring(1) : text;
    }

    /**
     * Extracts the host part of a URL; accepts scheme-less URLs as logged by most proxies
     */
    public static String hostFromUrl(String url) {
        String text = clean(url);
        if (text == null) {
            return null;
        }
        int scheme = text.indexOf("://");
        if (scheme >= 0) {
            text = text.substring(scheme + 3);
        }
        int end = text.length();
        for (char c : new char[]{'/', '?', '#'}) {
            int idx = text.indexOf(c);
            if (idx >= 0 && idx < end) {
                end = idx;
            }
        }
        String authority = text.substring(0, end);
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        if (!authority.startsWith("[")) {
            int colon = authority.indexOf(':');
            if (colon >= 0) {
                authority = authority.substring(0, colon);
            }
        }
        authority = authority.toLowerCase(Locale.ROOT);
        if (authority.isEmpty() || WHITESPACE.matcher(authority).find()) {
            return null;
        }
        return authority;
    }

    private static String mapVocabulary(String value, Map<String, String> vocabulary) {
        String text = clean(value);
        if (text == null) {
            return null;
        }
        String mapped = vocabulary.get(text.toLowerCase(Locale.ROOT));
        return mapped != null ? mapped : text;
    }

    private static Function<String, Instant> utc(String pattern) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);
        return text -> LocalDateTime.parse(text, formatter).toInstant(ZoneOffset.UTC);
    }

    private static Instant tryParse(Function<String, Instant> format, String text) {
        try {
            return format.apply(text);
        } catch (DateTimeParseException e) {
            // not this format
            return null;
        }
    }
}
