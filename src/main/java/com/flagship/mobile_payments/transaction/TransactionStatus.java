package com.flagship.mobile_payments.transaction;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Status of a payment transaction.
 *
 * Transitions are monotone: once a transaction reaches a terminal status
 * nothing can move it again, and nothing ever moves back into QUEUED.
 *
 * <pre>
 * QUEUED     -> PROCESSING | FAILED | ERROR | CANCELLED | TIMEOUT
 * PROCESSING -> PENDING | COMPLETED | FAILED | CANCELLED | ERROR | TIMEOUT
 * PENDING    -> COMPLETED | FAILED | CANCELLED | ERROR | TIMEOUT
 * </pre>
 */
public enum TransactionStatus {
    /**
     * Accepted by the request queue, not yet sent to the gateway.
     */
    QUEUED,

    /**
     * Gateway accepted the push request and returned a remote checkout id.
     */
    PROCESSING,

    /**
     * Gateway reports the user has not approved the prompt yet.
     */
    PENDING,

    COMPLETED,
    FAILED,
    CANCELLED,
    ERROR,
    TIMEOUT;

    private static final Set<TransactionStatus> TERMINAL =
            EnumSet.of(COMPLETED, FAILED, CANCELLED, ERROR, TIMEOUT);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Checks whether the state machine allows moving from this status to the target.
     * A status never transitions to itself.
     */
    public boolean canTransitionTo(TransactionStatus target) {
        if (target == null || target == this) {
            return false;
        }
        return switch (this) {
            case QUEUED -> target == PROCESSING || target == FAILED || target == ERROR
                    || target == CANCELLED || target == TIMEOUT;
            case PROCESSING -> target != QUEUED;
            case PENDING -> target != QUEUED && target != PROCESSING;
            case COMPLETED, FAILED, CANCELLED, ERROR, TIMEOUT -> false;
        };
    }

    /**
     * All statuses from which the target can be reached in one step.
     */
    public static Set<TransactionStatus> predecessorsOf(TransactionStatus target) {
        Set<TransactionStatus> predecessors = EnumSet.noneOf(TransactionStatus.class);
        for (TransactionStatus candidate : values()) {
            if (candidate.canTransitionTo(target)) {
                predecessors.add(candidate);
            }
        }
        return predecessors;
    }

    public static Set<TransactionStatus> live() {
        return EnumSet.complementOf(EnumSet.copyOf(TERMINAL));
    }

    /**
     * Lower-case name used on the wire ("queued", "completed", ...).
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire name, case-insensitively.
     */
    public static Optional<TransactionStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(status -> status.name().equals(normalized))
                .findFirst();
    }
}
