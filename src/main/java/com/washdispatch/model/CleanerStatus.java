package com.washdispatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CleanerStatus {
    OFF_DUTY,
    ON_DUTY,
    BUSY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CleanerStatus fromWireName(String value) {
        return value == null ? null : CleanerStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
