package dao.tron.msig.repository;

import dao.tron.msig.model.PendingTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Local pending-transaction set, owned by a single coordinator instance.
 * Implementations hand out copies; a {@link #save} that returns normally is durable.
 */
public interface PendingTransactionStore {

    void save(PendingTransaction record);

    List<PendingTransaction> findAll();

    Optional<PendingTransaction> findById(String id);

    Optional<PendingTransaction> findByTxId(String txId);

    /**
     * @return false if no record had that id
     */
    boolean delete(String id);
}
