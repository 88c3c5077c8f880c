package com.workshopos.domain;

/**
 * Phase reported in a TrainingPortal resource status.
 */
public enum PortalPhase {
    PENDING("Pending"),
    RUNNING("Running"),
    ERROR("Error"),
    RETRYING("Retrying");

    private final String value;

    PortalPhase(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Returns null for a missing or unrecognised phase. */
    public static PortalPhase fromValue(String value) {
        if (value == null) return null;
        for (PortalPhase phase : values()) {
            if (phase.value.equals(value)) return phase;
        }
        return null;
    }
}
