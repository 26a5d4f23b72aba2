package dao.tron.msig.gateway;

import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.util.TronAddresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.tron.trident.abi.FunctionEncoder;
import org.tron.trident.abi.TypeReference;
import org.tron.trident.abi.datatypes.Address;
import org.tron.trident.abi.datatypes.Bool;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.proto.Chain;
import org.tron.trident.proto.Response;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
public class NativeAccountGatewayTrident implements NativeAccountGateway {

    private static final int OWNER_PERMISSION_ID = 0;

    private final TronNode node;

    public NativeAccountGatewayTrident(TronNode node) {
        this.node = node;
    }

    @Override
    public AccountPermission fetchPermission(String account, int permissionId) {
        try {
            var acct = node.wrapper().getAccount(TronAddresses.normalize(account));
            if (acct == null || acct.getAddress().isEmpty()) {
                throw new MultisigException(FailureReason.NOT_FOUND, "Account not found or not activated: " + account);
            }

            // requested permission, else first active, else owner
            var chosen = acct.getOwnerPermission();
            boolean found = permissionId == OWNER_PERMISSION_ID && acct.hasOwnerPermission();
            if (permissionId != OWNER_PERMISSION_ID) {
                for (var perm : acct.getActivePermissionList()) {
                    if (perm.getId() == permissionId) {
                        chosen = perm;
                        found = true;
                        break;
                    }
                }
            }
            if (!found && acct.getActivePermissionCount() > 0) {
                chosen = acct.getActivePermission(0);
                found = true;
            }
            if (!found && !acct.hasOwnerPermission()) {
                // plain account: its own key, threshold 1
                return new AccountPermission(OWNER_PERMISSION_ID, "owner", 1,
                        List.of(TronAddresses.normalize(account)));
            }

            List<String> keys = new ArrayList<>();
            for (var key : chosen.getKeysList()) {
                keys.add(TronAddresses.encode(key.getAddress().toByteArray()));
            }
            return new AccountPermission(chosen.getId(), chosen.getPermissionName(), (int) chosen.getThreshold(), keys);
        } catch (MultisigException e) {
            throw e;
        } catch (Exception e) {
            log.error("getAccount failed for {}", account, e);
            throw new MultisigException(FailureReason.NETWORK_FAILURE, "getAccount failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Chain.Transaction createTrxTransfer(String from, String to, long amountSun) {
        try {
            Response.TransactionExtention txnExt = node.wrapper().transfer(from, to, amountSun);
            return requireBuilt(txnExt, "createTrxTransfer");
        } catch (MultisigException e) {
            throw e;
        } catch (Exception e) {
            log.error("createTrxTransfer failed", e);
            throw new MultisigException(FailureReason.NETWORK_FAILURE, "createTrxTransfer failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Chain.Transaction createTrc20Transfer(String from, String token, String to, BigInteger amount, long feeLimit) {
        Function transferFn = new Function(
                "transfer",
                List.of(new Address(new BigInteger(1, TronAddresses.accountId(to))), new Uint256(amount)),
                Collections.singletonList(new TypeReference<Bool>() {})
        );
        try {
            Response.TransactionExtention txnExt = node.wrapper().triggerContract(
                    from,
                    token,
                    FunctionEncoder.encode(transferFn),
                    0L,
                    0L,
                    null,
                    feeLimit
            );
            return requireBuilt(txnExt, "createTrc20Transfer");
        } catch (MultisigException e) {
            throw e;
        } catch (Exception e) {
            log.error("createTrc20Transfer failed", e);
            throw new MultisigException(FailureReason.NETWORK_FAILURE, "createTrc20Transfer failed: " + e.getMessage(), e);
        }
    }

    private static Chain.Transaction requireBuilt(Response.TransactionExtention txnExt, String operation) {
        if (!txnExt.getResult().getResult()) {
            throw new MultisigException(FailureReason.NETWORK_FAILURE,
                    operation + " rejected by node: " + txnExt.getResult().getMessage().toStringUtf8());
        }
        return txnExt.getTransaction();
    }

    @Override
    public String broadcast(Chain.Transaction signed) {
        ApiWrapper api = node.wrapper();
        try {
            return api.broadcastTransaction(signed);
        } catch (Exception e) {
            log.warn("Broadcast rejected: {}", e.getMessage());
            throw new MultisigException(FailureReason.BROADCAST_REJECTED, e.getMessage(), e);
        }
    }

    @Override
    public boolean isSettled(String txId) {
        Response.TransactionInfo info;
        try {
            info = node.wrapper().getTransactionInfoById(txId);
        } catch (MultisigException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MultisigException(FailureReason.NETWORK_FAILURE, "getTransactionInfoById failed: " + e.getMessage(), e);
        } catch (Exception e) {
            // Trident signals an unknown id with a checked exception
            log.debug("No TransactionInfo for {}: {}", txId, e.getMessage());
            return false;
        }
        return info != null && info.getBlockNumber() > 0;
    }
}
