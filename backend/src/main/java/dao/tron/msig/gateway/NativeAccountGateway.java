package dao.tron.msig.gateway;

import org.tron.trident.proto.Chain;

import java.math.BigInteger;

/**
 * Network primitives used by the signature coordinator.
 * Implementations report transport problems as {@code MultisigException} with a
 * TRANSPORT reason.
 */
public interface NativeAccountGateway {

    /**
     * Signer roster and threshold of {@code account} under the given permission id.
     */
    AccountPermission fetchPermission(String account, int permissionId);

    /** Unsigned native-asset transfer; amount in SUN. */
    Chain.Transaction createTrxTransfer(String from, String to, long amountSun);

    /** Unsigned TRC20 {@code transfer(address,uint256)} call. */
    Chain.Transaction createTrc20Transfer(String from, String token, String to, BigInteger amount, long feeLimit);

    /**
     * Submits a fully signed transaction.
     *
     * @return network-assigned transaction id
     */
    String broadcast(Chain.Transaction signed);

    /** True once the transaction is included in a block. */
    boolean isSettled(String txId);
}
