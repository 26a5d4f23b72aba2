package dao.tron.msig.vault;

/**
 * OPEN is the only non-terminal state. The three terminal states all block further
 * approve, revoke and cancel calls in the same way.
 */
public enum ProposalState {
    OPEN,
    COMPLETED,
    CANCELLED,
    EXPIRED
}
