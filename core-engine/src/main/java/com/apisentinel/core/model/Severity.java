package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert and incident severity, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {

    INFO,
    WARNING,
    MAJOR,
    CRITICAL;

    /**
     * @param other severity to compare with
     * @return {@code true} if this severity is the same as or above {@code other}
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * @return the next band up, or {@link #CRITICAL} if already at the top
     */
    public Severity bump() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }

    /**
     * @return the more severe of {@code a} and {@code b}; a {@code null}
     *         argument is ignored
     */
    public static Severity max(Severity a, Severity b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
