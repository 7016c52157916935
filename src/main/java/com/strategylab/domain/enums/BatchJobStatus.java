package com.strategylab.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a batch job. Transitions only move forward:
 * QUEUED -> RUNNING -> FINISHED | FAILED. FINISHED and FAILED are terminal.
 */
public enum BatchJobStatus {
    QUEUED,
    RUNNING,
    FINISHED,
    FAILED;

    public boolean isTerminal() {
        return this == FINISHED || this == FAILED;
    }

    /** Whether a job may move from this status to {@code next}. */
    public boolean canTransitionTo(BatchJobStatus next) {
        return !isTerminal() && next.ordinal() > ordinal();
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup; returns null for anything that is not a known status. */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BatchJobStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (BatchJobStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
