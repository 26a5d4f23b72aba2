package dao.tron.msig.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.model.PendingTransaction;
import dao.tron.msig.model.PendingTxStatus;
import dao.tron.msig.support.Payloads;
import dao.tron.msig.util.TronTransactions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tron.trident.proto.Chain;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static dao.tron.msig.support.Custodians.A;
import static dao.tron.msig.support.Custodians.B;
import static dao.tron.msig.support.Custodians.KEY_A;
import static org.junit.jupiter.api.Assertions.*;

class FilePendingTransactionStoreTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path dir;

    private static PendingTransaction record(String id, String memo) {
        Chain.Transaction tx = Payloads.unsigned(memo, 1_700_000_060_000L);
        tx = TronTransactions.addSignature(tx, TronTransactions.sign(TronTransactions.txId(tx), KEY_A));
        return PendingTransaction.builder()
                .id(id)
                .txId(TronTransactions.txIdHex(tx))
                .payload(tx.toByteArray())
                .fromAddress(A)
                .toAddress(B)
                .amount(new BigInteger("123456789012345678901234567890"))
                .asset(PendingTransaction.NATIVE_ASSET)
                .threshold(2)
                .signers(TronTransactions.recoverSigners(tx))
                .createdAt(1_700_000_000_000L)
                .expiresAt(1_700_000_060_000L)
                .status(PendingTxStatus.PENDING)
                .build();
    }

    @Test
    void survivesRestart() {
        Path file = dir.resolve("nested/pending.json");
        FilePendingTransactionStore store = new FilePendingTransactionStore(file, mapper);
        PendingTransaction saved = record("r2", "second");
        saved.setStatus(PendingTxStatus.FAILED);
        saved.setDescription("payroll");
        saved.setErrorMessage("BANDWITH_ERROR");
        saved.setBroadcastTxId("ab".repeat(32));
        store.save(record("r1", "first"));
        store.save(saved);
        store.delete("r1");

        FilePendingTransactionStore reopened = new FilePendingTransactionStore(file, mapper);

        List<PendingTransaction> all = reopened.findAll();
        assertEquals(1, all.size());
        PendingTransaction loaded = all.get(0);
        assertEquals("r2", loaded.getId());
        assertEquals(saved.getTxId(), loaded.getTxId());
        assertArrayEquals(saved.getPayload(), loaded.getPayload());
        assertEquals(A, loaded.getFromAddress());
        assertEquals(B, loaded.getToAddress());
        assertEquals(new BigInteger("123456789012345678901234567890"), loaded.getAmount());
        assertEquals(PendingTransaction.NATIVE_ASSET, loaded.getAsset());
        assertEquals(2, loaded.getThreshold());
        assertEquals(List.of(A), loaded.getSigners());
        assertEquals(1_700_000_000_000L, loaded.getCreatedAt());
        assertEquals(1_700_000_060_000L, loaded.getExpiresAt());
        assertEquals(PendingTxStatus.FAILED, loaded.getStatus());
        assertEquals("payroll", loaded.getDescription());
        assertEquals("BANDWITH_ERROR", loaded.getErrorMessage());
        assertEquals("ab".repeat(32), loaded.getBroadcastTxId());
        assertTrue(reopened.findByTxId(loaded.getTxId().toUpperCase()).isPresent());
    }

    @Test
    void signersAreRecomputedOnLoad() throws Exception {
        Path file = dir.resolve("pending.json");
        PendingTransaction forged = record("r1", "forged");
        forged.setSigners(List.of(A, B));
        Files.writeString(file, mapper.writeValueAsString(List.of(forged)));

        FilePendingTransactionStore store = new FilePendingTransactionStore(file, mapper);

        assertEquals(List.of(A), store.findById("r1").orElseThrow().getSigners());
    }

    @Test
    void unreadableFileFailsStartup() throws Exception {
        Path file = dir.resolve("pending.json");
        Files.writeString(file, "[{\"id\":");

        MultisigException ex = assertThrows(MultisigException.class,
                () -> new FilePendingTransactionStore(file, mapper));
        assertEquals(FailureReason.STORE_FAILURE, ex.getReason());
    }

    @Test
    void failedWriteLeavesMemoryUnchanged() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        FilePendingTransactionStore store = new FilePendingTransactionStore(blocker.resolve("pending.json"), mapper);

        MultisigException ex = assertThrows(MultisigException.class, () -> store.save(record("r1", "x")));

        assertEquals(FailureReason.STORE_FAILURE, ex.getReason());
        assertTrue(store.findAll().isEmpty());
    }

    @Test
    void returnedRecordsAreCopies() {
        FilePendingTransactionStore store = new FilePendingTransactionStore(dir.resolve("p.json"), mapper);
        store.save(record("r1", "x"));

        store.findById("r1").orElseThrow().getSigners().add(B);

        assertEquals(List.of(A), store.findById("r1").orElseThrow().getSigners());
    }
}
