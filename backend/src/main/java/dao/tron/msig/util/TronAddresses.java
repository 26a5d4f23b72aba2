package dao.tron.msig.util;

import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import org.tron.trident.utils.Base58Check;
import org.tron.trident.utils.Numeric;
import org.web3j.crypto.Keys;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * TRON address parsing and encoding.
 * <p>
 * An address is 21 bytes: the 0x41 network prefix followed by the last 20 bytes of
 * keccak256(publicKey). It is accepted as base58check ("T...") or as 42 hex chars ("41...")
 * and always normalized to base58check.
 */
public final class TronAddresses {
    private TronAddresses() {}

    public static final byte ADDRESS_PREFIX = 0x41;
    public static final int ADDRESS_LENGTH = 21;

    public static final String ZERO_ADDRESS = encode(new byte[20]);

    public static String normalize(String address) {
        return Base58Check.bytesToBase58(toBytes(address));
    }

    public static byte[] toBytes(String address) {
        if (address == null || address.isBlank()) {
            throw invalid(address);
        }
        String value = address.trim();
        byte[] raw;
        try {
            if (value.length() == 42 && value.regionMatches(true, 0, "41", 0, 2)) {
                raw = Numeric.hexStringToByteArray(value);
            } else if (value.length() == 44 && value.regionMatches(true, 0, "0x41", 0, 4)) {
                raw = Numeric.hexStringToByteArray(value.substring(2));
            } else {
                raw = Base58Check.base58ToBytes(value);
            }
        } catch (RuntimeException e) {
            throw invalid(address);
        }
        if (raw.length != ADDRESS_LENGTH || raw[0] != ADDRESS_PREFIX) {
            throw invalid(address);
        }
        return raw;
    }

    public static boolean isWellFormed(String address) {
        try {
            toBytes(address);
            return true;
        } catch (MultisigException e) {
            return false;
        }
    }

    public static boolean isZero(String address) {
        byte[] raw = toBytes(address);
        for (int i = 1; i < raw.length; i++) {
            if (raw[i] != 0) return false;
        }
        return true;
    }

    /** Base58 address for a 20-byte account id (no prefix) or a 21-byte prefixed address. */
    public static String encode(byte[] accountId) {
        if (accountId.length == ADDRESS_LENGTH) {
            return Base58Check.bytesToBase58(accountId);
        }
        if (accountId.length != 20) {
            throw new IllegalArgumentException("Account id must be 20 bytes, got " + accountId.length);
        }
        byte[] raw = new byte[ADDRESS_LENGTH];
        raw[0] = ADDRESS_PREFIX;
        System.arraycopy(accountId, 0, raw, 1, 20);
        return Base58Check.bytesToBase58(raw);
    }

    public static String fromPublicKey(BigInteger publicKey) {
        return encode(Numeric.hexStringToByteArray(Keys.getAddress(publicKey)));
    }

    /** 20-byte account id, as used in ABI-encoded address arguments. */
    public static byte[] accountId(String address) {
        byte[] raw = toBytes(address);
        return Arrays.copyOfRange(raw, 1, ADDRESS_LENGTH);
    }

    private static MultisigException invalid(String address) {
        return new MultisigException(FailureReason.INVALID_ADDRESS, "Malformed TRON address: " + address);
    }
}
