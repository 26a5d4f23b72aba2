package dao.tron.msig.util;

import org.bouncycastle.jcajce.provider.digest.SHA256;

import java.security.SecureRandom;

/**
 * Hashing and random id helpers.
 *
 * TRON transaction ids are sha256 over the serialized raw_data; signatures are produced
 * over that digest directly, without hashing again.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    private static final SecureRandom RNG = new SecureRandom();

    public static byte[] sha256(byte[] data) {
        return new SHA256.Digest().digest(data);
    }

    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }

    /**
     * Local record id: creation millis plus a random suffix, so two custodians creating
     * records in the same millisecond still get distinct ids.
     */
    public static String newLocalId(long nowMillis) {
        byte[] suffix = new byte[4];
        RNG.nextBytes(suffix);
        return nowMillis + "-" + toHex(suffix);
    }
}
