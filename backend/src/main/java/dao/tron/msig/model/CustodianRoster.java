package dao.tron.msig.model;

import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.util.TronAddresses;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered set of custodian addresses plus the number of them required to act.
 * Immutable once built; {@code 1 <= threshold <= size} always holds.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CustodianRoster {

    private final List<String> owners;
    private final int threshold;

    private CustodianRoster(List<String> owners, int threshold) {
        this.owners = owners;
        this.threshold = threshold;
    }

    public static CustodianRoster of(List<String> owners, int threshold) {
        if (owners == null || owners.isEmpty()) {
            throw new MultisigException(FailureReason.INVALID_ROSTER, "Roster must contain at least one custodian");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String owner : owners) {
            String normalized = TronAddresses.normalize(owner);
            if (TronAddresses.isZero(normalized)) {
                throw new MultisigException(FailureReason.INVALID_ROSTER, "Zero address cannot be a custodian");
            }
            if (!unique.add(normalized)) {
                throw new MultisigException(FailureReason.INVALID_ROSTER, "Duplicate custodian: " + normalized);
            }
        }
        if (threshold < 1 || threshold > unique.size()) {
            throw new MultisigException(FailureReason.INVALID_ROSTER,
                    "Threshold must be between 1 and " + unique.size() + ", got " + threshold);
        }
        return new CustodianRoster(Collections.unmodifiableList(new ArrayList<>(unique)), threshold);
    }

    public boolean contains(String address) {
        if (!TronAddresses.isWellFormed(address)) return false;
        return owners.contains(TronAddresses.normalize(address));
    }

    public int size() {
        return owners.size();
    }
}
