package dao.tron.msig.util;

import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.support.Custodians;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class TransferValidationTest {

    @Test
    void requireRecipient_rejectsZeroAddress() {
        MultisigException ex = assertThrows(MultisigException.class,
                () -> TransferValidation.requireRecipient(TronAddresses.ZERO_ADDRESS));
        assertEquals(FailureReason.ZERO_ADDRESS, ex.getReason());
    }

    @Test
    void requireRecipient_rejectsMalformedAddress() {
        MultisigException ex = assertThrows(MultisigException.class,
                () -> TransferValidation.requireRecipient("TXYZ"));
        assertEquals(FailureReason.INVALID_ADDRESS, ex.getReason());
    }

    @Test
    void requireRecipient_returnsNormalizedAddress() {
        assertEquals(Custodians.A, TransferValidation.requireRecipient(Custodians.A));
    }

    @Test
    void requirePositiveAmount_rejectsZeroNegativeAndNull() {
        for (BigInteger bad : new BigInteger[]{null, BigInteger.ZERO, BigInteger.valueOf(-1)}) {
            MultisigException ex = assertThrows(MultisigException.class,
                    () -> TransferValidation.requirePositiveAmount(bad));
            assertEquals(FailureReason.ZERO_AMOUNT, ex.getReason());
        }
        assertDoesNotThrow(() -> TransferValidation.requirePositiveAmount(BigInteger.ONE));
    }
}
