package dao.tron.msig.event;

public record ProposalApprovedEvent(long proposalId, String custodian, int approvalCount) {}
