package dao.tron.msig.contract;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.math.BigInteger;

/**
 * A proposal as stored by the deployed contract. The contract keeps a single
 * {@code executed} flag for completed and cancelled proposals alike.
 */
public record OnChainProposal(long id,
                              String to,
                              @JsonSerialize(using = ToStringSerializer.class) BigInteger amount,
                              boolean executed,
                              long approvalCount,
                              long createdAt) {}
