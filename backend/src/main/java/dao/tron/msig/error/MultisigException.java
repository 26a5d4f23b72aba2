package dao.tron.msig.error;

import lombok.Getter;

/**
 * Base exception for custody errors. Every failure carries a {@link FailureReason}
 * so callers can branch on the reason instead of parsing messages.
 */
@Getter
public class MultisigException extends RuntimeException {

    private final FailureReason reason;

    public MultisigException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MultisigException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public ErrorCategory getCategory() {
        return reason.getCategory();
    }

    public static MultisigException notFound(String what, Object id) {
        return new MultisigException(FailureReason.NOT_FOUND, what + " not found: " + id);
    }
}
