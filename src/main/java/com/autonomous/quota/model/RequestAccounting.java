package com.autonomous.quota.model;

import com.autonomous.quota.exception.RejectionReason;
import lombok.Data;

/**
 * Accounting for a single in-flight request. Owned by the thread handling that request.
 */
@Data
public class RequestAccounting {
    private String model;
    private int promptTokens;
    private int completionTokens;
    private double estimatedCost;
    private double finalCost;
    private AdmissionState state = AdmissionState.RECEIVED;
    private RejectionReason rejectionReason;

    public void advance(AdmissionState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Cannot move request from " + state + " to " + next);
        }
        this.state = next;
    }

    public void reject(RejectionReason reason) {
        advance(AdmissionState.REJECTED);
        this.rejectionReason = reason;
    }

    public ProxyUsage toProxyUsage() {
        return ProxyUsage.builder()
            .promptTokens(promptTokens)
            .completionTokens(completionTokens)
            .costUsd(truncateToMicros(finalCost))
            .build();
    }

    /** Drops digits past the sixth decimal; cost is never negative. */
    static double truncateToMicros(double cost) {
        return Math.floor(cost * 1_000_000.0) / 1_000_000.0;
    }
}
