package dao.tron.msig.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.model.PendingTransaction;
import dao.tron.msig.model.PendingTxStatus;
import dao.tron.msig.support.Payloads;
import dao.tron.msig.util.TronTransactions;
import org.junit.jupiter.api.Test;
import org.tron.trident.proto.Chain;

import java.math.BigInteger;
import java.util.List;

import static dao.tron.msig.support.Custodians.A;
import static dao.tron.msig.support.Custodians.B;
import static dao.tron.msig.support.Custodians.C;
import static dao.tron.msig.support.Custodians.KEY_A;
import static dao.tron.msig.support.Custodians.KEY_B;
import static org.junit.jupiter.api.Assertions.*;

class PendingTransactionCodecTest {

    private static final long EXPIRATION = 1_714_565_160_000L;

    private final PendingTransactionCodec codec = new PendingTransactionCodec(new ObjectMapper());

    private static Chain.Transaction signedBy(Chain.Transaction tx, org.web3j.crypto.ECKeyPair... keys) {
        for (org.web3j.crypto.ECKeyPair key : keys) {
            tx = TronTransactions.addSignature(tx, TronTransactions.sign(TronTransactions.txId(tx), key));
        }
        return tx;
    }

    @Test
    void decodeTrustsOnlyThePayload() {
        Chain.Transaction tx = signedBy(Payloads.trxTransfer(A, B, 5_000_000L, "codec", EXPIRATION), KEY_A, KEY_B);
        PendingTransaction record = PendingTransaction.builder()
                .id("local-1")
                .payload(tx.toByteArray())
                .toAddress(B)
                .amount(BigInteger.valueOf(5_000_000L))
                .threshold(2)
                .signers(List.of(B))
                .expiresAt(1L)
                .status(PendingTxStatus.READY)
                .description("quarterly")
                .build();

        PendingTransaction decoded = codec.decode(codec.encode(record));

        assertEquals(TronTransactions.txIdHex(tx), decoded.getTxId());
        assertEquals(List.of(A, B), decoded.getSigners());
        assertEquals(EXPIRATION, decoded.getExpiresAt());
        assertEquals(A, decoded.getFromAddress());
        assertEquals(BigInteger.valueOf(5_000_000L), decoded.getAmount());
        assertEquals(PendingTransaction.NATIVE_ASSET, decoded.getAsset());
        assertEquals("quarterly", decoded.getDescription());
        assertEquals("local-1", decoded.getId());
        assertArrayEquals(tx.toByteArray(), decoded.getPayload());
    }

    @Test
    void trc20TermsComeFromTheCallData() {
        BigInteger amount = new BigInteger("18446744073709551616");
        Chain.Transaction tx = Payloads.trc20Transfer(A, C, B, amount, "codec", EXPIRATION);
        PendingTransaction record = PendingTransaction.builder().id("x").payload(tx.toByteArray()).threshold(1).build();

        PendingTransaction decoded = codec.decode(codec.encode(record));

        assertEquals(A, decoded.getFromAddress());
        assertEquals(B, decoded.getToAddress());
        assertEquals(C, decoded.getAsset());
        assertEquals(amount, decoded.getAmount());
    }

    @Test
    void mismatchedAmountIsRejected() {
        Chain.Transaction tx = Payloads.trxTransfer(A, B, 1_000_000_000L, "codec", EXPIRATION);
        PendingTransaction record = PendingTransaction.builder()
                .id("x").payload(tx.toByteArray()).threshold(1).amount(BigInteger.ONE).build();

        MultisigException ex = assertThrows(MultisigException.class, () -> codec.decode(codec.encode(record)));
        assertEquals(FailureReason.INVALID_IMPORT, ex.getReason());
    }

    @Test
    void nonTransferPayloadIsRejected() {
        Chain.Transaction tx = Payloads.unsigned("codec", EXPIRATION);
        PendingTransaction record = PendingTransaction.builder().id("x").payload(tx.toByteArray()).threshold(1).build();

        MultisigException ex = assertThrows(MultisigException.class, () -> codec.decode(codec.encode(record)));
        assertEquals(FailureReason.INVALID_IMPORT, ex.getReason());
    }

    @Test
    void encodedAmountIsADecimalString() {
        PendingTransaction record = PendingTransaction.builder()
                .id("x")
                .amount(new BigInteger("123456789012345678901234567890"))
                .build();

        assertTrue(codec.encode(record).contains("\"amount\":\"123456789012345678901234567890\""));
    }

    @Test
    void thresholdBelowOneIsRejected() {
        Chain.Transaction tx = Payloads.trxTransfer(A, B, 1L, "codec", EXPIRATION);
        PendingTransaction record = PendingTransaction.builder().id("x").payload(tx.toByteArray()).threshold(0).build();

        MultisigException ex = assertThrows(MultisigException.class, () -> codec.decode(codec.encode(record)));
        assertEquals(FailureReason.INVALID_IMPORT, ex.getReason());
    }

    @Test
    void unknownFieldsAreIgnored() {
        Chain.Transaction tx = Payloads.trxTransfer(A, B, 1L, "codec", EXPIRATION);
        PendingTransaction record = PendingTransaction.builder().id("x").payload(tx.toByteArray()).threshold(1).build();
        String blob = codec.encode(record).replaceFirst("\\{", "{\"futureField\":true,");

        assertEquals("x", codec.decode(blob).getId());
    }
}
