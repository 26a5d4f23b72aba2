package dao.tron.msig.repository;

import dao.tron.msig.model.PendingTransaction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryPendingTransactionStore implements PendingTransactionStore {

    // key: local id, insertion ordered
    protected final Map<String, PendingTransaction> recordsById = new LinkedHashMap<>();

    @Override
    public synchronized void save(PendingTransaction record) {
        recordsById.put(record.getId(), record.copy());
    }

    @Override
    public synchronized List<PendingTransaction> findAll() {
        List<PendingTransaction> all = new ArrayList<>();
        for (PendingTransaction record : recordsById.values()) {
            all.add(record.copy());
        }
        return all;
    }

    @Override
    public synchronized Optional<PendingTransaction> findById(String id) {
        return Optional.ofNullable(recordsById.get(id)).map(PendingTransaction::copy);
    }

    @Override
    public synchronized Optional<PendingTransaction> findByTxId(String txId) {
        return recordsById.values().stream()
                .filter(r -> r.getTxId() != null && r.getTxId().equalsIgnoreCase(txId))
                .findFirst()
                .map(PendingTransaction::copy);
    }

    @Override
    public synchronized boolean delete(String id) {
        return recordsById.remove(id) != null;
    }
}
