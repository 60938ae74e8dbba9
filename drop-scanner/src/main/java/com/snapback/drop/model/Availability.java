package com.snapback.drop.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Registration state of a domain as far as DNS can tell.
 */
public enum Availability {
    REGISTERED,
    AVAILABLE,
    UNKNOWN;

    /** JSON form: true when available, false when registered, null when unknown. */
    @JsonValue
    public Boolean asFlag() {
        return switch (this) {
            case AVAILABLE -> Boolean.TRUE;
            case REGISTERED -> Boolean.FALSE;
            case UNKNOWN -> null;
        };
    }

    /** CSV form: "true", "false" or "unknown". */
    public String asToken() {
        return this == UNKNOWN ? "unknown" : asFlag().toString();
    }
}
