package com.accesslog.risk.engine.schema;

import java.util.List;
import java.util.Locale;

/**
 * Canonical log columns and the header names accepted for each, in priority order.
 * Matching is exact after trimming and lower-casing; misspellings are only tolerated
 * when listed here.
 */
public enum CanonicalField {

    ADDRESS("address", List.of("address", "ip", "ip_address", "source_ip", "client_ip")),
    TIMESTAMP("timestamp", List.of("timestamp", "time", "datetime", "event_time")),
    ENDPOINT("endpoint", List.of("endpoint", "url", "uri", "path", "request")),
    STATUS("status", List.of("status", "staus", "status_code", "response_code"));

    private final String fieldName;
    private final List<String> aliases;

    CanonicalField(String fieldName, List<String> aliases) {
        this.fieldName = fieldName;
        this.aliases = aliases;
    }

    public String fieldName() {
        return fieldName;
    }

    public List<String> aliases() {
        return aliases;
    }

    public static String normalizeHeader(String header) {
        return header == null ? "" : header.trim().toLowerCase(Locale.ROOT);
    }
}
