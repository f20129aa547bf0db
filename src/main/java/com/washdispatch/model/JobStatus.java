package com.washdispatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a wash job. Transitions are only ever applied while holding the job row lock.
 */
public enum JobStatus {
    PENDING_PAYMENT,
    PAID,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    REFUNDED,
    REFUNDED_UNATTENDED;

    private static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, CANCELLED, REFUNDED, REFUNDED_UNATTENDED);
    private static final Set<JobStatus> WITH_CLEANER = EnumSet.of(ASSIGNED, IN_PROGRESS, COMPLETED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** Statuses in which a job must carry a cleaner id. */
    public boolean holdsCleaner() {
        return WITH_CLEANER.contains(this);
    }

    public boolean canTransitionTo(JobStatus target) {
        if (target == null || isTerminal()) return false;

        // manual refund and administrative cancel are open to every live job
        if (target == REFUNDED || target == CANCELLED) return true;

        return switch (this) {
            case PENDING_PAYMENT -> target == PAID || target == ASSIGNED || target == REFUNDED_UNATTENDED;
            case PAID -> target == ASSIGNED || target == REFUNDED_UNATTENDED;
            case ASSIGNED -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == COMPLETED;
            default -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromWireName(String value) {
        return value == null ? null : JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
