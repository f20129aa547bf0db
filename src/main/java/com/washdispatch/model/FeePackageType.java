package com.washdispatch.model;

import java.util.Locale;

/**
 * How a company's platform fee is derived.
 * CUSTOM uses the configured amount, PACKAGE1 is 2.00 + 5% of the wash price,
 * PACKAGE2 is offline payment with no platform fee.
 */
public enum FeePackageType {
    CUSTOM,
    PACKAGE1,
    PACKAGE2;

    /** Lenient parse; unknown or blank values fall back to CUSTOM. */
    public static FeePackageType parse(String value) {
        if (value == null || value.isBlank()) return CUSTOM;
        try {
            return FeePackageType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CUSTOM;
        }
    }
}
