package com.proxylens.domain;

/**
 * Well-known keys of the evidence map carried by a {@link Finding}.
 * Rules may add their own keys next to these.
 */
public final class EvidenceKeys {

    public static final String USER_EMAIL = "user_email";
    public static final String CLIENT_IP = "client_ip";
    public static final String DEST_HOST = "dest_host";
    public static final String THREAT_CATEGORY = "threat_category";
    public static final String THREAT_CATEGORIES = "threat_categories";
    public static final String BUCKET = "bucket";
    public static final String COUNT = "count";
    public static final String THRESHOLD = "threshold";
    public static final String EVENT_IDS = "event_ids";
    public static final String FIRST_SEEN = "first_seen";
    public static final String LAST_SEEN = "last_seen";
    public static final String URLS = "urls";
    public static final String SECURITY_OUTCOME = "security_outcome";
    public static final String MITRE = "mitre";
    public static final String HOW_TO_VERIFY = "how_to_verify";

    private EvidenceKeys() {
    }
}
