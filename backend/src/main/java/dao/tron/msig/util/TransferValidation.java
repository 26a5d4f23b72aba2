package dao.tron.msig.util;

import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;

import java.math.BigInteger;

/** Checks applied to every requested transfer, on-chain or off-chain. */
public final class TransferValidation {
    private TransferValidation() {}

    /**
     * @return the recipient normalized to base58check
     */
    public static String requireRecipient(String to) {
        String normalized = TronAddresses.normalize(to);
        if (TronAddresses.isZero(normalized)) {
            throw new MultisigException(FailureReason.ZERO_ADDRESS, "Recipient must not be the zero address");
        }
        return normalized;
    }

    public static void requirePositiveAmount(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new MultisigException(FailureReason.ZERO_AMOUNT, "Amount must be positive, got " + amount);
        }
    }
}
