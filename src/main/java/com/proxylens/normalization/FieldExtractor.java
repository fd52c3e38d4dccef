package com.proxylens.normalization;

import com.google.common.collect.ImmutableList;
import com.proxylens.domain.Event;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a tokenized field map onto a typed {@link Event}.
 *
 * Each attribute has an ordered alias list; the first alias with a usable value
 * wins. Field maps are case-insensitive, so aliases are written in lower case.
 */
@Component
public class FieldExtractor {

    static final List<String> TIMESTAMP = ImmutableList.of(
        "datetime", "timestamp", "@timestamp", "time", "ts", "eventtime", "event_time", "date", "rt", "end", "start");
    static final List<String> EVENT_ID = ImmutableList.of(
        "event_id", "eventid", "recordid", "record_id", "externalid", "id");
    static final List<String> VENDOR = ImmutableList.of(
        "vendor", "devicevendor", "product", "deviceproduct");
    static final List<String> ACTION = ImmutableList.of(
        "action", "act", "disposition", "decision", "policy_action");
    static final List<String> REASON = ImmutableList.of(
        "reason", "msg", "message", "name", "reason_text");
    static final List<String> SEVERITY = ImmutableList.of(
        "severity", "sev", "level", "risk_level", "threatseverity");
    static final List<String> HTTP_STATUS = ImmutableList.of(
        "status", "statuscode", "status_code", "http_status", "respcode", "responsecode");
    static final List<String> USER = ImmutableList.of(
        "user", "user_email", "useremail", "suser", "usr", "username", "user_name", "login", "duser");
    static final List<String> DEPARTMENT = ImmutableList.of(
        "department", "dept", "user_department");
    static final List<String> LOCATION = ImmutableList.of(
        "location", "loc", "site");
    static final List<String> CLIENT_IP = ImmutableList.of(
        "clientip", "client_ip", "cip", "src", "src_ip", "srcip", "sourceip", "source_ip", "clientinternalip", "ip");
    static final List<String> SERVER_IP = ImmutableList.of(
        "serverip", "server_ip", "sip", "dst", "dst_ip", "dstip", "destinationip", "destination_ip");
    static final List<String> DEST_HOST = ImmutableList.of(
        "hostname", "host", "dhost", "dest_host", "desthost", "destination", "domain", "server_name", "sni");
    static final List<String> URL = ImmutableList.of(
        "url", "request", "requrl", "request_url", "eurl", "uri");
    static final List<String> REQUEST_METHOD = ImmutableList.of(
        "requestmethod", "request_method", "method", "reqmethod", "http_method");
    static final List<String> URL_CATEGORY = ImmutableList.of(
        "urlcategory", "url_category", "urlcat", "category", "cat", "urlsupercategory");
    static final List<String> THREAT_CATEGORY = ImmutableList.of(
        "threatcategory", "threat_category", "threat_type", "threatclass", "malwarecategory");
    static final List<String> THREAT_NAME = ImmutableList.of(
        "threatname", "threat_name", "threat", "malware", "malwarename", "signature");
    static final List<String> RISK_SCORE = ImmutableList.of(
        "riskscore", "risk_score", "risk", "score");
    static final List<String> REQUEST_SIZE = ImmutableList.of(
        "requestsize", "request_size", "reqsize", "bytes_in", "in");
    static final List<String> RESPONSE_SIZE = ImmutableList.of(
        "responsesize", "response_size", "respsize", "bytes_out", "out");
    static final List<String> TRANSACTION_SIZE = ImmutableList.of(
        "transactionsize", "transaction_size", "totalsize", "bytes");

    /**
     * Build an event from tokenized fields. Never fails: unusable values leave
     * their attribute empty.
     */
    public Event extract(String uploadId, LogDialect dialect, Map<String, String> rawFields, String raw) {
        Map<String, String> fields = lowerCaseKeys(rawFields);
        String url = first(fields, URL);
        String destHost = first(fields, DEST_HOST);
        if (destHost != null) {
            destHost = destHost.toLowerCase(Locale.ROOT);
        } else {
            destHost = FieldValues.hostFromUrl(url);
        }

        return Event.builder()
            .uploadId(uploadId)
            .raw(raw)
            .dialect(dialect.getValue())
            .timestamp(FieldValues.parseTimestamp(first(fields, TIMESTAMP)))
            .vendorEventId(first(fields, EVENT_ID))
            .vendor(first(fields, VENDOR))
            .action(FieldValues.normalizeAction(first(fields, ACTION)))
            .reason(first(fields, REASON))
            .severity(FieldValues.normalizeSeverity(first(fields, SEVERITY)))
            .httpStatus(first(fields, HTTP_STATUS))
            .userEmail(first(fields, USER))
            .department(first(fields, DEPARTMENT))
            .location(first(fields, LOCATION))
            .clientIp(FieldValues.normalizeIp(first(fields, CLIENT_IP)))
            .serverIp(FieldValues.normalizeIp(first(fields, SERVER_IP)))
            .destHost(destHost)
            .url(url)
            .requestMethod(upper(first(fields, REQUEST_METHOD)))
            .urlCategory(first(fields, URL_CATEGORY))
            .threatCategory(FieldValues.normalizeThreatCategory(first(fields, THREAT_CATEGORY)))
            .threatName(first(fields, THREAT_NAME))
            .riskScore(FieldValues.parseInteger(first(fields, RISK_SCORE)))
            .requestSize(FieldValues.parseLong(first(fields, REQUEST_SIZE)))
            .responseSize(FieldValues.parseLong(first(fields, RESPONSE_SIZE)))
            .transactionSize(FieldValues.parseLong(first(fields, TRANSACTION_SIZE)))
            .build();
    }

    /**
     * First non-null cleaned value among the aliases
     */
    static String first(Map<String, String> fields, List<String> aliases) {
        for (String alias : aliases) {
            String value = FieldValues.clean(fields.get(alias));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Aliases are lower case; the first spelling of a key wins
     */
    static Map<String, String> lowerCaseKeys(Map<String, String> fields) {
        Map<String, String> lowered = new HashMap<>();
        fields.forEach((key, value) -> lowered.putIfAbsent(key.toLowerCase(Locale.ROOT), value));
        return lowered;
    }

    private static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
