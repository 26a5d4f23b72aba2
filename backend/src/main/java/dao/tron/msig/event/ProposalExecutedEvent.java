package dao.tron.msig.event;

import java.math.BigInteger;

public record ProposalExecutedEvent(long proposalId, String to, BigInteger amount) {}
