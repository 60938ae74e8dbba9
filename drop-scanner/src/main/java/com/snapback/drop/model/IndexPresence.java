package com.snapback.drop.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a domain has historical content in a content index.
 */
public enum IndexPresence {
    PRESENT,
    ABSENT,
    UNKNOWN;

    @JsonValue
    public Boolean asFlag() {
        return switch (this) {
            case PRESENT -> Boolean.TRUE;
            case ABSENT -> Boolean.FALSE;
            case UNKNOWN -> null;
        };
    }

    public String asToken() {
        return this == UNKNOWN ? "unknown" : asFlag().toString();
    }
}
