package com.jz.guard.guard;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DecisionReason {
    APPROVED,
    USER_BLOCKED,
    RATE_LIMITED,
    CONTENT_FLAGGED,
    INVALID_INPUT,
    INTERNAL_ERROR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
