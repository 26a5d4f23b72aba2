package dao.tron.msig.vault;

import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.gateway.TronNode;
import dao.tron.msig.util.TronAddresses;
import lombok.extern.slf4j.Slf4j;
import org.tron.trident.abi.FunctionEncoder;
import org.tron.trident.abi.FunctionReturnDecoder;
import org.tron.trident.abi.TypeReference;
import org.tron.trident.abi.datatypes.Address;
import org.tron.trident.abi.datatypes.Bool;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.Type;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.core.NodeType;
import org.tron.trident.proto.Response;
import org.tron.trident.utils.Numeric;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * TRC20 ledger reached through Trident, spending from the local custodian account.
 * <p>
 * Errors before the broadcast abort the transfer. Once broadcast, a missing receipt is
 * reported as {@code false} and the caller's balance check decides.
 */
@Slf4j
public class Trc20TokenLedger implements TokenLedger {

    private final TronNode node;
    private final String tokenAddress;
    private final long feeLimit;

    public Trc20TokenLedger(TronNode node, String tokenAddress, long feeLimit) {
        this.node = node;
        this.tokenAddress = TronAddresses.normalize(tokenAddress);
        this.feeLimit = feeLimit;
    }

    @Override
    public String custodyAddress() {
        String owner = node.getOwnerAddress();
        if (owner == null) {
            throw new MultisigException(FailureReason.NETWORK_FAILURE, "Custody key is not configured");
        }
        return owner;
    }

    @Override
    public BigInteger balanceOf(String address) {
        Function fn = new Function(
                "balanceOf",
                Collections.singletonList(abiAddress(address)),
                Collections.singletonList(new TypeReference<Uint256>() {})
        );
        try {
            Response.TransactionExtention txn = node.wrapper().triggerConstantContract(
                    custodyAddress(),
                    tokenAddress,
                    FunctionEncoder.encode(fn),
                    NodeType.FULL_NODE
            );
            if (!txn.getResult().getResult() || txn.getConstantResultCount() == 0) {
                throw new MultisigException(FailureReason.NETWORK_FAILURE,
                        "balanceOf query failed: " + txn.getResult().getMessage().toStringUtf8());
            }
            String resultHex = Numeric.toHexString(txn.getConstantResult(0).toByteArray());
            @SuppressWarnings("rawtypes")
            List<Type> decoded = FunctionReturnDecoder.decode(resultHex, fn.getOutputParameters());
            if (decoded.isEmpty()) {
                throw new MultisigException(FailureReason.NETWORK_FAILURE, "Empty balanceOf result for " + address);
            }
            return ((Uint256) decoded.get(0)).getValue();
        } catch (MultisigException e) {
            throw e;
        } catch (Exception e) {
            log.error("balanceOf failed for {}", address, e);
            throw new MultisigException(FailureReason.NETWORK_FAILURE, "balanceOf failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean transfer(String to, BigInteger amount) {
        Function fn = new Function(
                "transfer",
                List.of(abiAddress(to), new Uint256(amount)),
                Collections.singletonList(new TypeReference<Bool>() {})
        );
        String txId;
        try {
            Response.TransactionExtention txnExt = node.wrapper().triggerContract(
                    custodyAddress(),
                    tokenAddress,
                    FunctionEncoder.encode(fn),
                    0L,
                    0L,
                    null,
                    feeLimit
            );
            if (!txnExt.getResult().getResult()) {
                throw new MultisigException(FailureReason.TRANSFER_FAILED,
                        "transfer trigger failed: " + txnExt.getResult().getMessage().toStringUtf8());
            }
            txId = node.signAndBroadcast(txnExt);
        } catch (MultisigException e) {
            throw e;
        } catch (Exception e) {
            log.error("Token transfer failed", e);
            throw new MultisigException(FailureReason.TRANSFER_FAILED, "transfer failed: " + e.getMessage(), e);
        }

        // after the broadcast only a definite on-chain failure aborts the caller
        Response.TransactionInfo info;
        try {
            info = node.awaitSuccess(txId, "transfer");
        } catch (MultisigException e) {
            if (e.getReason() != FailureReason.NETWORK_FAILURE) {
                throw e;
            }
            log.warn("No receipt for token transfer {} to {}: {}", txId, to, e.getMessage());
            return false;
        }
        log.info("Token transfer SUCCESS: to={}, amount={}, txId={}", to, amount, txId);

        if (info.getContractResultCount() == 0 || info.getContractResult(0).isEmpty()) {
            // legacy tokens return nothing from transfer()
            return false;
        }
        String resultHex = Numeric.toHexString(info.getContractResult(0).toByteArray());
        @SuppressWarnings("rawtypes")
        List<Type> decoded = FunctionReturnDecoder.decode(resultHex, fn.getOutputParameters());
        return !decoded.isEmpty() && ((Bool) decoded.get(0)).getValue();
    }

    private static Address abiAddress(String address) {
        return new Address(new BigInteger(1, TronAddresses.accountId(address)));
    }
}
