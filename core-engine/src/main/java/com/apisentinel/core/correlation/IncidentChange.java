package com.apisentinel.core.correlation;

import com.apisentinel.core.model.Incident;

import java.util.Objects;

/**
 * A new version of an incident published by the correlator.
 *
 * @since 1.0.0
 */
public final class IncidentChange {

    public enum Type {
        OPENED,
        UPDATED,
        CLOSED
    }

    private final Type type;
    private final Incident incident;

    public IncidentChange(Type type, Incident incident) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.incident = Objects.requireNonNull(incident, "incident must not be null");
    }

    public Type getType() {
        return type;
    }

    public Incident getIncident() {
        return incident;
    }

    @Override
    public String toString() {
        return type + " " + incident;
    }
}
