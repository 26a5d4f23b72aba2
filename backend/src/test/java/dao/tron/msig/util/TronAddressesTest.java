package dao.tron.msig.util;

import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.ECKeyPair;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class TronAddressesTest {

    @Test
    @DisplayName("Address of private key 1 matches the well-known account id")
    void fromPublicKey_knownVector() {
        ECKeyPair one = ECKeyPair.create(BigInteger.ONE);
        String expected = TronAddresses.normalize("417e5f4552091a69125d5dfcb7b8c2659029395bdf");

        assertEquals(expected, TronAddresses.fromPublicKey(one.getPublicKey()));
        assertTrue(expected.startsWith("T"));
    }

    @Test
    void normalize_acceptsHexAndBase58Forms() {
        String hex = "417e5f4552091a69125d5dfcb7b8c2659029395bdf";
        String base58 = TronAddresses.normalize(hex);

        assertEquals(base58, TronAddresses.normalize(base58));
        assertEquals(base58, TronAddresses.normalize("0x" + hex));
        assertEquals(base58, TronAddresses.normalize(hex.toUpperCase()));
    }

    @Test
    void zeroAddress_isDetected() {
        assertTrue(TronAddresses.isZero(TronAddresses.ZERO_ADDRESS));
        assertTrue(TronAddresses.isZero("41" + "00".repeat(20)));
        assertFalse(TronAddresses.isZero("417e5f4552091a69125d5dfcb7b8c2659029395bdf"));
    }

    @Test
    void malformedAddresses_areRejected() {
        assertFalse(TronAddresses.isWellFormed(null));
        assertFalse(TronAddresses.isWellFormed(""));
        assertFalse(TronAddresses.isWellFormed("not-an-address"));
        // wrong network prefix
        assertFalse(TronAddresses.isWellFormed("a07e5f4552091a69125d5dfcb7b8c2659029395bdf"));

        MultisigException ex = assertThrows(MultisigException.class, () -> TronAddresses.toBytes("T123"));
        assertEquals(FailureReason.INVALID_ADDRESS, ex.getReason());
    }

    @Test
    void accountId_dropsPrefix() {
        byte[] id = TronAddresses.accountId("417e5f4552091a69125d5dfcb7b8c2659029395bdf");
        assertEquals(20, id.length);
        assertEquals((byte) 0x7e, id[0]);
        assertEquals(TronAddresses.normalize("417e5f4552091a69125d5dfcb7b8c2659029395bdf"), TronAddresses.encode(id));
    }
}
