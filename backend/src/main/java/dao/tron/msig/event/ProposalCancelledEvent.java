package dao.tron.msig.event;

public record ProposalCancelledEvent(long proposalId, String custodian, CancelReason reason) {}
