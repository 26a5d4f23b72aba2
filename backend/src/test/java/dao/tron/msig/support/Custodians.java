package dao.tron.msig.support;

import dao.tron.msig.util.TronAddresses;
import org.web3j.crypto.ECKeyPair;

import java.math.BigInteger;

/** Fixed custodian keys so signatures and addresses are reproducible across runs. */
public final class Custodians {
    private Custodians() {}

    public static final ECKeyPair KEY_A = ECKeyPair.create(new BigInteger("a1".repeat(32), 16));
    public static final ECKeyPair KEY_B = ECKeyPair.create(new BigInteger("b2".repeat(32), 16));
    public static final ECKeyPair KEY_C = ECKeyPair.create(new BigInteger("c3".repeat(32), 16));
    public static final ECKeyPair KEY_D = ECKeyPair.create(new BigInteger("d4".repeat(32), 16));

    public static final String A = address(KEY_A);
    public static final String B = address(KEY_B);
    public static final String C = address(KEY_C);
    public static final String D = address(KEY_D);

    public static String address(ECKeyPair keyPair) {
        return TronAddresses.fromPublicKey(keyPair.getPublicKey());
    }
}
