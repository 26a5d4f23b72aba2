package dao.tron.msig.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import dao.tron.msig.util.Expiry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * A locally tracked, partially signed TRON transfer.
 * <p>
 * {@code id} is assigned locally; {@code txId} is the network id derived from the payload.
 * {@code signers} is always re-derived from the signatures inside {@code payload}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PendingTransaction {

    public static final String NATIVE_ASSET = "TRX";

    private String id;

    /** sha256(raw_data), lowercase hex */
    private String txId;

    /** Serialized Chain.Transaction including every collected signature. */
    private byte[] payload;

    private String fromAddress;
    private String toAddress;

    @JsonSerialize(using = ToStringSerializer.class)
    private BigInteger amount;

    /** "TRX" or the token contract address (base58) */
    private String asset;

    private int threshold;

    @Builder.Default
    private List<String> signers = new ArrayList<>();

    private long createdAt;     // epoch millis
    private long expiresAt;     // epoch millis, raw_data.expiration

    private PendingTxStatus status;

    private String description;
    private String errorMessage;
    private String broadcastTxId;

    public int signatureCount() {
        return signers == null ? 0 : signers.size();
    }

    public int remainingSignatures() {
        return Math.max(0, threshold - signatureCount());
    }

    public boolean isExpiredAt(long nowMillis) {
        return Expiry.isExpired(nowMillis, expiresAt);
    }

    public boolean canBroadcastAt(long nowMillis) {
        return signatureCount() >= threshold
                && !isExpiredAt(nowMillis)
                && (status == PendingTxStatus.PENDING || status == PendingTxStatus.READY);
    }

    @JsonIgnore
    public boolean isNativeAsset() {
        return NATIVE_ASSET.equalsIgnoreCase(asset);
    }

    public PendingTransaction copy() {
        return toBuilder()
                .payload(payload == null ? null : payload.clone())
                .signers(signers == null ? new ArrayList<>() : new ArrayList<>(signers))
                .build();
    }
}
