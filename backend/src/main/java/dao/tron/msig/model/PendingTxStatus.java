package dao.tron.msig.model;

/**
 * Lifecycle of a pending transaction. BROADCAST, FAILED and EXPIRED are terminal for
 * broadcasting and expiry. A FAILED record still takes signatures and imports; either one
 * re-derives PENDING or READY from the signer count, which is the only way back to broadcast.
 */
public enum PendingTxStatus {
    PENDING,
    READY,
    BROADCAST,
    FAILED,
    EXPIRED;

    public boolean acceptsSignatures() {
        return this == PENDING || this == READY || this == FAILED;
    }
}
