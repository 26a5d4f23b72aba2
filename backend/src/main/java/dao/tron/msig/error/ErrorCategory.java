package dao.tron.msig.error;

/**
 * Coarse failure classes shared by the vault and the signature coordinator.
 * Controllers map each category to one HTTP status.
 */
public enum ErrorCategory {
    AUTHORIZATION,
    NOT_FOUND,
    INVALID_STATE,
    VALIDATION,
    RESOURCE,
    TRANSPORT
}
