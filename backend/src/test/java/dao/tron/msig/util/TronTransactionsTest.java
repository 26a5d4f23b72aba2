package dao.tron.msig.util;

import com.google.protobuf.ByteString;
import dao.tron.msig.support.Custodians;
import dao.tron.msig.support.Payloads;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tron.trident.proto.Chain;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TronTransactionsTest {

    private static final long EXPIRATION = 1_700_000_060_000L;

    @Test
    void txId_isSha256OfRawData() {
        Chain.Transaction tx = Payloads.unsigned("txid", EXPIRATION);
        assertArrayEquals(CryptoUtil.sha256(tx.getRawData().toByteArray()), TronTransactions.txId(tx));
        assertEquals(64, TronTransactions.txIdHex(tx).length());
    }

    @Test
    void signature_recoversToSigner() {
        Chain.Transaction tx = Payloads.unsigned("recover", EXPIRATION);
        byte[] txId = TronTransactions.txId(tx);

        byte[] sig = TronTransactions.sign(txId, Custodians.KEY_A);

        assertEquals(65, sig.length);
        assertTrue(sig[64] == 0 || sig[64] == 1);
        assertEquals(Custodians.A, TronTransactions.recoverSigner(txId, sig).orElseThrow());
    }

    @Test
    void signatureOverOtherPayload_doesNotRecoverToSigner() {
        byte[] txId = TronTransactions.txId(Payloads.unsigned("one", EXPIRATION));
        byte[] otherTxId = TronTransactions.txId(Payloads.unsigned("two", EXPIRATION));
        byte[] sig = TronTransactions.sign(otherTxId, Custodians.KEY_A);

        assertNotEquals(Custodians.A, TronTransactions.recoverSigner(txId, sig).orElse(null));
    }

    @Test
    void malformedSignature_isIgnored() {
        byte[] txId = TronTransactions.txId(Payloads.unsigned("bad", EXPIRATION));
        assertTrue(TronTransactions.recoverSigner(txId, new byte[10]).isEmpty());
        assertTrue(TronTransactions.recoverSigner(txId, new byte[65]).isEmpty());
    }

    @Test
    @DisplayName("prepare extends expiration, stamps permission id and drops stale signatures")
    void prepare_rebuildsRawData() {
        Chain.Transaction tx = Payloads.unsigned("prepare", EXPIRATION);
        Chain.Transaction signed = TronTransactions.addSignature(tx,
                TronTransactions.sign(TronTransactions.txId(tx), Custodians.KEY_A));

        Chain.Transaction prepared = TronTransactions.prepare(signed, 300_000L, 2);

        assertEquals(EXPIRATION + 300_000L, prepared.getRawData().getExpiration());
        assertEquals(2, prepared.getRawData().getContract(0).getPermissionId());
        assertEquals(0, prepared.getSignatureCount());
        assertFalse(Arrays.equals(TronTransactions.txId(tx), TronTransactions.txId(prepared)));
    }

    @Test
    void recoverSigners_countsEachSignerOnce() {
        Chain.Transaction tx = Payloads.unsigned("dedupe", EXPIRATION);
        byte[] txId = TronTransactions.txId(tx);
        byte[] sigA = TronTransactions.sign(txId, Custodians.KEY_A);

        Chain.Transaction twice = TronTransactions.addSignature(TronTransactions.addSignature(tx, sigA), sigA);

        assertEquals(List.of(Custodians.A), TronTransactions.recoverSigners(twice));
    }

    @Test
    void mergeSignatures_isUnionAndIdempotent() {
        Chain.Transaction tx = Payloads.unsigned("merge", EXPIRATION);
        byte[] txId = TronTransactions.txId(tx);
        Chain.Transaction byA = TronTransactions.addSignature(tx, TronTransactions.sign(txId, Custodians.KEY_A));
        Chain.Transaction byAB = TronTransactions.addSignature(byA, TronTransactions.sign(txId, Custodians.KEY_B));
        Chain.Transaction byC = TronTransactions.addSignature(tx, TronTransactions.sign(txId, Custodians.KEY_C));

        Chain.Transaction merged = TronTransactions.mergeSignatures(byAB, byC);
        assertEquals(List.of(Custodians.A, Custodians.B, Custodians.C), TronTransactions.recoverSigners(merged));
        assertEquals(3, merged.getSignatureCount());

        Chain.Transaction again = TronTransactions.mergeSignatures(merged, byAB);
        assertEquals(3, again.getSignatureCount());
        assertEquals(merged, again);
    }

    @Test
    void mergeSignatures_dropsUnrecoverableSignatures() {
        Chain.Transaction tx = Payloads.unsigned("junk", EXPIRATION);
        Chain.Transaction junk = tx.toBuilder().addSignature(ByteString.copyFrom(new byte[7])).build();

        Chain.Transaction merged = TronTransactions.mergeSignatures(tx, junk);

        assertEquals(0, merged.getSignatureCount());
    }

    @Test
    void mergeSignatures_rejectsDifferentTransactions() {
        assertThrows(IllegalArgumentException.class, () -> TronTransactions.mergeSignatures(
                Payloads.unsigned("x", EXPIRATION), Payloads.unsigned("y", EXPIRATION)));
    }

    @Test
    void parse_rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> TronTransactions.parse(new byte[]{(byte) 0xff, 0x01}));
        // valid protobuf but no contract
        assertThrows(IllegalArgumentException.class,
                () -> TronTransactions.parse(Chain.Transaction.getDefaultInstance().toByteArray()));
    }

    @Test
    void transferTerms_fromTrxTransfer() {
        Chain.Transaction tx = Payloads.trxTransfer(Custodians.A, Custodians.B, 2_500_000L, "terms", EXPIRATION);

        TronTransactions.TransferTerms terms = TronTransactions.transferTerms(tx);

        assertEquals(Custodians.A, terms.from());
        assertEquals(Custodians.B, terms.to());
        assertEquals(BigInteger.valueOf(2_500_000L), terms.amount());
        assertEquals("TRX", terms.asset());
    }

    @Test
    void transferTerms_fromTrc20CallData() {
        BigInteger max = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
        Chain.Transaction tx = Payloads.trc20Transfer(Custodians.A, Custodians.C, Custodians.B, max, "terms", EXPIRATION);

        TronTransactions.TransferTerms terms = TronTransactions.transferTerms(tx);

        assertEquals(Custodians.A, terms.from());
        assertEquals(Custodians.B, terms.to());
        assertEquals(max, terms.amount());
        assertEquals(Custodians.C, terms.asset());
    }

    @Test
    void transferTerms_rejectsOtherContracts() {
        assertThrows(IllegalArgumentException.class,
                () -> TronTransactions.transferTerms(Payloads.unsigned("terms", EXPIRATION)));
    }
}
