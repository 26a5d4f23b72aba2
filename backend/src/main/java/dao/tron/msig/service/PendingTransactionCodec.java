package dao.tron.msig.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.model.PendingTransaction;
import dao.tron.msig.util.TronAddresses;
import dao.tron.msig.util.TronTransactions;
import org.springframework.stereotype.Component;
import org.tron.trident.proto.Chain;

/**
 * Export format shared between custodians: the record as JSON, payload base64-encoded.
 * <p>
 * Decoding trusts only the payload. The txId, expiry, signer set and transfer terms
 * (sender, recipient, amount, asset) are re-derived from it; a blob whose own copy of any
 * of them disagrees with the payload is rejected.
 */
@Component
public class PendingTransactionCodec {

    private final ObjectMapper mapper;

    public PendingTransactionCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(PendingTransaction record) {
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize pending transaction " + record.getId(), e);
        }
    }

    public PendingTransaction decode(String blob) {
        if (blob == null || blob.isBlank()) {
            throw invalid("empty blob", null);
        }
        PendingTransaction record;
        try {
            record = mapper.readValue(blob.trim(), PendingTransaction.class);
        } catch (JsonProcessingException e) {
            throw invalid("not a pending transaction export", e);
        }
        if (record == null || record.getPayload() == null || record.getPayload().length == 0) {
            throw invalid("missing payload", null);
        }

        Chain.Transaction tx;
        try {
            tx = TronTransactions.parse(record.getPayload());
        } catch (IllegalArgumentException e) {
            throw invalid(e.getMessage(), e);
        }
        String txId = TronTransactions.txIdHex(tx);
        if (record.getTxId() != null && !record.getTxId().equalsIgnoreCase(txId)) {
            throw invalid("txId " + record.getTxId() + " does not match payload " + txId, null);
        }
        if (record.getThreshold() < 1) {
            throw invalid("threshold must be at least 1", null);
        }

        TronTransactions.TransferTerms terms;
        try {
            terms = TronTransactions.transferTerms(tx);
        } catch (IllegalArgumentException e) {
            throw invalid(e.getMessage(), e);
        }
        requireMatches("fromAddress", record.getFromAddress(), terms.from());
        requireMatches("toAddress", record.getToAddress(), terms.to());
        requireMatches("asset", record.getAsset(), terms.asset());
        if (record.getAmount() != null && record.getAmount().compareTo(terms.amount()) != 0) {
            throw invalid("amount " + record.getAmount() + " does not match payload " + terms.amount(), null);
        }

        record.setTxId(txId);
        record.setFromAddress(terms.from());
        record.setToAddress(terms.to());
        record.setAmount(terms.amount());
        record.setAsset(terms.asset());
        record.setSigners(TronTransactions.recoverSigners(tx));
        long expiration = tx.getRawData().getExpiration();
        if (expiration > 0) {
            record.setExpiresAt(expiration);
        }
        return record;
    }

    private static void requireMatches(String field, String claimed, String actual) {
        if (claimed == null || claimed.isBlank()) {
            return;
        }
        boolean same = TronAddresses.isWellFormed(claimed)
                ? TronAddresses.normalize(claimed).equals(actual)
                : claimed.equalsIgnoreCase(actual);
        if (!same) {
            throw invalid(field + " " + claimed + " does not match payload " + actual, null);
        }
    }

    private static MultisigException invalid(String detail, Throwable cause) {
        return new MultisigException(FailureReason.INVALID_IMPORT, "Invalid import: " + detail, cause);
    }
}
