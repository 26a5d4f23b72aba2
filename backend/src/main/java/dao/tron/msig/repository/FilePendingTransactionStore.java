package dao.tron.msig.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.model.PendingTransaction;
import dao.tron.msig.util.TronTransactions;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Pending set persisted as one JSON array. Every mutation rewrites the file through a
 * temp file and an atomic rename; if the write fails the mutation is undone in memory too.
 */
@Slf4j
public class FilePendingTransactionStore extends InMemoryPendingTransactionStore {

    private static final TypeReference<List<PendingTransaction>> LIST_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;

    public FilePendingTransactionStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("No pending transaction file at {}, starting empty", file);
            return;
        }
        try {
            List<PendingTransaction> records = mapper.readValue(file.toFile(), LIST_TYPE);
            for (PendingTransaction record : records) {
                // signer set is derived data; rebuild it from the signatures
                record.setSigners(TronTransactions.recoverSigners(TronTransactions.parse(record.getPayload())));
                recordsById.put(record.getId(), record);
            }
            log.info("Loaded {} pending transactions from {}", recordsById.size(), file);
        } catch (IOException | IllegalArgumentException e) {
            throw new MultisigException(FailureReason.STORE_FAILURE,
                    "Cannot read pending transactions from " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void save(PendingTransaction record) {
        PendingTransaction previous = recordsById.get(record.getId());
        super.save(record);
        try {
            flush();
        } catch (IOException e) {
            if (previous == null) {
                recordsById.remove(record.getId());
            } else {
                recordsById.put(previous.getId(), previous);
            }
            throw storeFailure(e);
        }
    }

    @Override
    public synchronized boolean delete(String id) {
        PendingTransaction previous = recordsById.get(id);
        if (previous == null) return false;
        super.delete(id);
        try {
            flush();
        } catch (IOException e) {
            recordsById.put(id, previous);
            throw storeFailure(e);
        }
        return true;
    }

    private void flush() throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), new ArrayList<>(recordsById.values()));
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private MultisigException storeFailure(IOException e) {
        log.error("Failed to persist pending transactions to {}", file, e);
        return new MultisigException(FailureReason.STORE_FAILURE, "Failed to persist pending transactions: " + e.getMessage(), e);
    }
}
