package dao.tron.msig.event;

public enum CancelReason {
    /** Last active approval was revoked. */
    ZERO_APPROVALS,
    /** Cancelled by a custodian after the approval window closed. */
    EXPIRED
}
