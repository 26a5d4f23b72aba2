package dao.tron.msig.event;

public record ApprovalRevokedEvent(long proposalId, String custodian, int approvalCount) {}
