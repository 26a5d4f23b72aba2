package dao.tron.msig.vault;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import dao.tron.msig.util.Expiry;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Snapshot of a transfer proposal held by {@link CustodyVault}. Instances are immutable;
 * the vault replaces them on every transition.
 */
@Value
@Builder(toBuilder = true)
public class Proposal {

    long id;
    String proposer;
    String to;

    @JsonSerialize(using = ToStringSerializer.class)
    BigInteger amount;

    @With
    int approvalCount;

    Instant createdAt;
    Instant expiresAt;

    @With
    ProposalState state;

    /** Terminal, whether completed or cancelled. */
    public boolean isExecuted() {
        return state != ProposalState.OPEN;
    }

    public boolean isExpiredAt(Instant now) {
        return state == ProposalState.OPEN && Expiry.isExpired(now, expiresAt);
    }
}
