package dao.tron.msig.vault;

import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.event.ApprovalRevokedEvent;
import dao.tron.msig.event.CancelReason;
import dao.tron.msig.event.ProposalApprovedEvent;
import dao.tron.msig.event.ProposalCancelledEvent;
import dao.tron.msig.event.ProposalExecutedEvent;
import dao.tron.msig.event.ProposalSubmittedEvent;
import dao.tron.msig.model.CustodianRoster;
import dao.tron.msig.util.Expiry;
import dao.tron.msig.util.TransferValidation;
import dao.tron.msig.util.TronAddresses;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * M-of-N approval ledger for transfers out of a single custody account.
 * <p>
 * Each mutating call is all-or-nothing: if anything fails, including the transfer
 * triggered when quorum is reached, proposals, approvals, the id counter and pending
 * notifications are restored to what they were before the call. Notifications are
 * published only once the outermost call commits.
 * <p>
 * A proposal is finalized before the ledger transfer is invoked, so a ledger that calls
 * back into the vault sees it as already terminal.
 */
@Slf4j
public class CustodyVault {

    @Getter
    private final CustodianRoster roster;
    private final TokenLedger ledger;
    @Getter
    private final Duration expirationPeriod;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    private Map<Long, Proposal> proposals = new LinkedHashMap<>();
    private Map<Long, Set<String>> approvals = new HashMap<>();
    private long nextId;

    private final List<Object> journal = new ArrayList<>();
    private int depth;

    public CustodyVault(CustodianRoster roster,
                        TokenLedger ledger,
                        Duration expirationPeriod,
                        Clock clock,
                        ApplicationEventPublisher publisher) {
        if (expirationPeriod == null || expirationPeriod.isNegative() || expirationPeriod.isZero()) {
            throw new IllegalArgumentException("Expiration period must be positive");
        }
        this.roster = roster;
        this.ledger = ledger;
        this.expirationPeriod = expirationPeriod;
        this.clock = clock;
        this.publisher = publisher;
        log.info("CustodyVault initialized: owners={}, threshold={}, expiration={}",
                roster.getOwners(), roster.getThreshold(), expirationPeriod);
    }

    public synchronized long submit(String caller, String to, BigInteger amount) {
        return inTransaction(() -> {
            String custodian = requireCustodian(caller);
            String recipient = TransferValidation.requireRecipient(to);
            TransferValidation.requirePositiveAmount(amount);

            long id = nextId++;
            Instant now = clock.instant();
            Proposal proposal = Proposal.builder()
                    .id(id)
                    .proposer(custodian)
                    .to(recipient)
                    .amount(amount)
                    .approvalCount(1)
                    .createdAt(now)
                    .expiresAt(Expiry.deadline(now, expirationPeriod))
                    .state(ProposalState.OPEN)
                    .build();
            proposals.put(id, proposal);
            Set<String> approvedBy = new LinkedHashSet<>();
            approvedBy.add(custodian);
            approvals.put(id, approvedBy);

            journal.add(new ProposalSubmittedEvent(id, custodian, recipient, amount));
            journal.add(new ProposalApprovedEvent(id, custodian, 1));

            executeIfQuorum(proposal);
            return id;
        });
    }

    public synchronized void approve(String caller, long id) {
        inTransaction(() -> {
            String custodian = requireCustodian(caller);
            Proposal proposal = requireOpen(id);
            Set<String> approvedBy = approvals.get(id);
            if (approvedBy.contains(custodian)) {
                throw new MultisigException(FailureReason.ALREADY_APPROVED,
                        custodian + " already approved proposal " + id);
            }
            approvedBy.add(custodian);
            Proposal updated = proposal.withApprovalCount(proposal.getApprovalCount() + 1);
            proposals.put(id, updated);
            journal.add(new ProposalApprovedEvent(id, custodian, updated.getApprovalCount()));

            executeIfQuorum(updated);
            return null;
        });
    }

    public synchronized void revoke(String caller, long id) {
        inTransaction(() -> {
            String custodian = requireCustodian(caller);
            Proposal proposal = requireOpen(id);
            Set<String> approvedBy = approvals.get(id);
            if (!approvedBy.remove(custodian)) {
                throw new MultisigException(FailureReason.NOT_APPROVED,
                        custodian + " has no active approval on proposal " + id);
            }
            Proposal updated = proposal.withApprovalCount(proposal.getApprovalCount() - 1);
            journal.add(new ApprovalRevokedEvent(id, custodian, updated.getApprovalCount()));
            if (updated.getApprovalCount() == 0) {
                updated = updated.withState(ProposalState.CANCELLED);
                journal.add(new ProposalCancelledEvent(id, custodian, CancelReason.ZERO_APPROVALS));
            }
            proposals.put(id, updated);
            return null;
        });
    }

    public synchronized void cancelExpired(String caller, long id) {
        inTransaction(() -> {
            String custodian = requireCustodian(caller);
            Proposal proposal = requireOpen(id);
            if (!proposal.isExpiredAt(clock.instant())) {
                throw new MultisigException(FailureReason.NOT_EXPIRED_YET,
                        "Proposal " + id + " is open until " + proposal.getExpiresAt());
            }
            proposals.put(id, proposal.withState(ProposalState.EXPIRED));
            journal.add(new ProposalCancelledEvent(id, custodian, CancelReason.EXPIRED));
            return null;
        });
    }

    // ---- queries ----

    public List<String> getOwners() {
        return roster.getOwners();
    }

    public int getOwnerCount() {
        return roster.size();
    }

    public boolean isOwner(String address) {
        return roster.contains(address);
    }

    public int getThreshold() {
        return roster.getThreshold();
    }

    public String getCustodyAddress() {
        return ledger.custodyAddress();
    }

    public synchronized long getTransactionCount() {
        return nextId;
    }

    public synchronized Proposal getTransaction(long id) {
        return requireExisting(id);
    }

    public synchronized List<Proposal> getTransactions() {
        return new ArrayList<>(proposals.values());
    }

    public synchronized boolean isApproved(long id, String custodian) {
        requireExisting(id);
        if (!TronAddresses.isWellFormed(custodian)) return false;
        return approvals.get(id).contains(TronAddresses.normalize(custodian));
    }

    public synchronized boolean isExpired(long id) {
        return requireExisting(id).isExpiredAt(clock.instant());
    }

    public BigInteger getBalance() {
        return ledger.balanceOf(ledger.custodyAddress());
    }

    // ---- internals ----

    private void executeIfQuorum(Proposal proposal) {
        if (proposal.getApprovalCount() < roster.getThreshold()) {
            return;
        }
        long id = proposal.getId();
        String custody = ledger.custodyAddress();
        BigInteger balance = ledger.balanceOf(custody);
        if (balance.compareTo(proposal.getAmount()) < 0) {
            throw new MultisigException(FailureReason.INSUFFICIENT_BALANCE,
                    "Custody balance " + balance + " is below " + proposal.getAmount() + " for proposal " + id);
        }

        proposals.put(id, proposal.withState(ProposalState.COMPLETED));

        boolean selfTransfer = proposal.getTo().equals(TronAddresses.normalize(custody));
        BigInteger recipientBefore = selfTransfer ? BigInteger.ZERO : ledger.balanceOf(proposal.getTo());
        boolean reported;
        try {
            reported = ledger.transfer(proposal.getTo(), proposal.getAmount());
        } catch (MultisigException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MultisigException(FailureReason.TRANSFER_FAILED,
                    "Token transfer aborted for proposal " + id + ": " + e.getMessage(), e);
        }

        if (!selfTransfer) {
            BigInteger delta = ledger.balanceOf(proposal.getTo()).subtract(recipientBefore);
            if (delta.compareTo(proposal.getAmount()) < 0) {
                throw new MultisigException(FailureReason.TRANSFER_FAILED,
                        "Recipient balance grew by " + delta + ", expected " + proposal.getAmount()
                                + " for proposal " + id);
            }
        }
        if (!reported) {
            log.debug("Ledger reported failure for proposal {} but the transfer is confirmed", id);
        }
        journal.add(new ProposalExecutedEvent(id, proposal.getTo(), proposal.getAmount()));
    }

    private String requireCustodian(String caller) {
        if (!roster.contains(caller)) {
            throw new MultisigException(FailureReason.NOT_AUTHORIZED, "Not a custodian: " + caller);
        }
        return TronAddresses.normalize(caller);
    }

    private Proposal requireExisting(long id) {
        Proposal proposal = proposals.get(id);
        if (proposal == null) {
            throw MultisigException.notFound("Proposal", id);
        }
        return proposal;
    }

    private Proposal requireOpen(long id) {
        Proposal proposal = requireExisting(id);
        if (proposal.isExecuted()) {
            throw new MultisigException(FailureReason.ALREADY_TERMINAL,
                    "Proposal " + id + " is already " + proposal.getState());
        }
        return proposal;
    }

    private <T> T inTransaction(Supplier<T> operation) {
        Map<Long, Proposal> proposalsBefore = new LinkedHashMap<>(proposals);
        Map<Long, Set<String>> approvalsBefore = new HashMap<>();
        approvals.forEach((k, v) -> approvalsBefore.put(k, new LinkedHashSet<>(v)));
        long nextIdBefore = nextId;
        int journalBefore = journal.size();

        depth++;
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            proposals = proposalsBefore;
            approvals = approvalsBefore;
            nextId = nextIdBefore;
            journal.subList(journalBefore, journal.size()).clear();
            throw e;
        } finally {
            depth--;
        }

        if (depth == 0) {
            List<Object> committed = new ArrayList<>(journal);
            journal.clear();
            committed.forEach(publisher::publishEvent);
        }
        return result;
    }
}
