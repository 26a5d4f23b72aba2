package dao.tron.msig.error;

import lombok.Getter;

@Getter
public enum FailureReason {
    NOT_AUTHORIZED(ErrorCategory.AUTHORIZATION),

    NOT_FOUND(ErrorCategory.NOT_FOUND),

    ALREADY_TERMINAL(ErrorCategory.INVALID_STATE),
    ALREADY_APPROVED(ErrorCategory.INVALID_STATE),
    NOT_APPROVED(ErrorCategory.INVALID_STATE),
    NOT_EXPIRED_YET(ErrorCategory.INVALID_STATE),
    ALREADY_SIGNED(ErrorCategory.INVALID_STATE),
    NOT_BROADCASTABLE(ErrorCategory.INVALID_STATE),

    ZERO_ADDRESS(ErrorCategory.VALIDATION),
    ZERO_AMOUNT(ErrorCategory.VALIDATION),
    AMOUNT_OUT_OF_RANGE(ErrorCategory.VALIDATION),
    INVALID_ADDRESS(ErrorCategory.VALIDATION),
    INVALID_ROSTER(ErrorCategory.VALIDATION),
    INVALID_IMPORT(ErrorCategory.VALIDATION),

    INSUFFICIENT_BALANCE(ErrorCategory.RESOURCE),
    TRANSFER_FAILED(ErrorCategory.RESOURCE),
    STORE_FAILURE(ErrorCategory.RESOURCE),

    BROADCAST_REJECTED(ErrorCategory.TRANSPORT),
    NETWORK_FAILURE(ErrorCategory.TRANSPORT);

    private final ErrorCategory category;

    FailureReason(ErrorCategory category) {
        this.category = category;
    }
}
