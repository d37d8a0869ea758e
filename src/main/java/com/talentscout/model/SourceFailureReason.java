package com.talentscout.model;

import java.util.Locale;

public enum SourceFailureReason {
    NONE("none"),
    TIMEOUT("timeout"),
    RATE_LIMIT("rate_limit"),
    HTTP_ERROR("http_error"),
    PARSE_ERROR("parse_error"),
    NOT_CONFIGURED("not_configured"),
    UNSUPPORTED_SOURCE("unsupported_source"),
    SOURCE_LIMIT("source_limit"),
    INTERRUPTED("interrupted"),
    OTHER("other");

    private final String label;

    SourceFailureReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SourceFailureReason fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return NONE;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (SourceFailureReason reason : values()) {
            if (reason.label.equals(target)) {
                return reason;
            }
        }
        return OTHER;
    }
}
