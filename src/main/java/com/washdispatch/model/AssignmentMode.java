package com.washdispatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AssignmentMode {
    POOL,
    DIRECT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
