package dao.tron.msig.event;

import java.math.BigInteger;

public record ProposalSubmittedEvent(long proposalId, String proposer, String to, BigInteger amount) {}
