package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of an {@link Alert}.
 *
 * <pre>
 *   OPEN ──(same dedup key again)──▶ SUPPRESSED
 *   OPEN | SUPPRESSED ──(clean samples, incident closed, resolve())──▶ RESOLVED
 * </pre>
 *
 * @since 1.0.0
 */
public enum AlertState {

    OPEN,
    SUPPRESSED,
    RESOLVED;

    /**
     * @return {@code true} for states that still represent an ongoing problem
     */
    public boolean isActive() {
        return this != RESOLVED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
