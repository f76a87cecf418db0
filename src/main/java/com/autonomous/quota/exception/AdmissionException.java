package com.autonomous.quota.exception;

/**
 * Terminal failure of one request. The ledger is never charged when this is thrown.
 */
public class AdmissionException extends RuntimeException {

    private final RejectionReason reason;

    public AdmissionException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AdmissionException(RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
