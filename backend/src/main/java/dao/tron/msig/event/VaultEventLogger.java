package dao.tron.msig.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Audit trail of committed vault operations. Completion and cancellation share a
 * terminal state, so this log is where the two are told apart.
 */
@Slf4j
@Component
public class VaultEventLogger {

    @EventListener
    public void onSubmitted(ProposalSubmittedEvent ev) {
        log.info("Proposal {} submitted by {}: {} -> {}", ev.proposalId(), ev.proposer(), ev.amount(), ev.to());
    }

    @EventListener
    public void onApproved(ProposalApprovedEvent ev) {
        log.info("Proposal {} approved by {} (approvals={})", ev.proposalId(), ev.custodian(), ev.approvalCount());
    }

    @EventListener
    public void onRevoked(ApprovalRevokedEvent ev) {
        log.info("Proposal {} approval revoked by {} (approvals={})", ev.proposalId(), ev.custodian(), ev.approvalCount());
    }

    @EventListener
    public void onExecuted(ProposalExecutedEvent ev) {
        log.info("Proposal {} executed: {} -> {}", ev.proposalId(), ev.amount(), ev.to());
    }

    @EventListener
    public void onCancelled(ProposalCancelledEvent ev) {
        log.info("Proposal {} cancelled by {} ({})", ev.proposalId(), ev.custodian(), ev.reason());
    }
}
