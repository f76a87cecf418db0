package com.autonomous.quota.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one request through the admission protocol. RECONCILED and REJECTED are terminal.
 */
public enum AdmissionState {
    RECEIVED,
    AUTHORIZED,
    ADMITTED,
    DISPATCHED,
    RECONCILED,
    REJECTED;

    public boolean canMoveTo(AdmissionState next) {
        return successors().contains(next);
    }

    private Set<AdmissionState> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(AUTHORIZED, REJECTED);
            case AUTHORIZED -> EnumSet.of(ADMITTED, REJECTED);
            case ADMITTED -> EnumSet.of(DISPATCHED, REJECTED);
            case DISPATCHED -> EnumSet.of(RECONCILED);
            case RECONCILED, REJECTED -> EnumSet.noneOf(AdmissionState.class);
        };
    }
}
