package dao.tron.msig.contract;

import java.math.BigInteger;
import java.util.List;

/**
 * Remote counterpart of the in-process vault: the same operations against a deployed
 * multisig contract. Write calls return the network transaction id once its receipt
 * reports success.
 */
public interface VaultContractClient {

    String submitTransaction(String to, BigInteger amount);

    String approveTransaction(long id);

    String revokeApproval(long id);

    String cancelExpiredTransaction(long id);

    List<String> getOwners();

    long getOwnerCount();

    long getThreshold();

    /** Seconds. */
    long getExpirationPeriod();

    long getTransactionCount();

    BigInteger getBalance();

    String getToken();

    OnChainProposal getTransaction(long id);

    boolean isApproved(long id, String owner);

    boolean isOwner(String address);

    boolean isExpired(long id);
}
