package dao.tron.msig.contract;

import dao.tron.msig.config.ContractProperties;
import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.gateway.TronNode;
import dao.tron.msig.util.TransferValidation;
import dao.tron.msig.util.TronAddresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.tron.trident.abi.FunctionEncoder;
import org.tron.trident.abi.datatypes.Address;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.Type;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.core.NodeType;
import org.tron.trident.proto.Response;
import org.tron.trident.utils.Numeric;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Calls are ABI-encoded with Trident; constant results are decoded with web3j.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "contract", name = "address")
public class VaultContractClientTrident implements VaultContractClient {

    private final TronNode node;
    private final String contractAddress;
    private final long feeLimit;

    public VaultContractClientTrident(TronNode node, ContractProperties props) {
        this.node = node;
        this.contractAddress = TronAddresses.normalize(props.getAddress());
        this.feeLimit = props.getFeeLimit();
        log.info("VaultContractClientTrident initialized: contract={}", contractAddress);
    }

    // ---- writes ----

    @Override
    public String submitTransaction(String to, BigInteger amount) {
        String recipient = TransferValidation.requireRecipient(to);
        TransferValidation.requirePositiveAmount(amount);
        return send("submitTransaction", List.of(abiAddress(recipient), new Uint256(amount)));
    }

    @Override
    public String approveTransaction(long id) {
        return send("approveTransaction", List.of(new Uint256(BigInteger.valueOf(id))));
    }

    @Override
    public String revokeApproval(long id) {
        return send("revokeApproval", List.of(new Uint256(BigInteger.valueOf(id))));
    }

    @Override
    public String cancelExpiredTransaction(long id) {
        return send("cancelExpiredTransaction", List.of(new Uint256(BigInteger.valueOf(id))));
    }

    @SuppressWarnings("rawtypes")
    private String send(String functionName, List<Type> inputs) {
        Function fn = new Function(functionName, inputs, Collections.emptyList());
        try {
            Response.TransactionExtention txnExt = node.wrapper().triggerContract(
                    node.getOwnerAddress(),
                    contractAddress,
                    FunctionEncoder.encode(fn),
                    0L,
                    0L,
                    null,
                    feeLimit
            );
            if (!txnExt.getResult().getResult()) {
                throw new MultisigException(FailureReason.NETWORK_FAILURE,
                        functionName + " trigger failed: " + txnExt.getResult().getMessage().toStringUtf8());
            }
            String txId = node.signAndBroadcast(txnExt);
            node.awaitSuccess(txId, functionName);
            log.info("{} SUCCESS: txId={}", functionName, txId);
            return txId;
        } catch (MultisigException e) {
            throw e;
        } catch (Exception e) {
            log.error("{} failed", functionName, e);
            throw new MultisigException(FailureReason.NETWORK_FAILURE, functionName + " failed: " + e.getMessage(), e);
        }
    }

    // ---- queries ----

    @Override
    public List<String> getOwners() {
        return decodeAddressArray(call("getOwners", Collections.emptyList()));
    }

    @Override
    public long getOwnerCount() {
        return decodeUint(call("getOwnerCount", Collections.emptyList())).longValueExact();
    }

    @Override
    public long getThreshold() {
        return decodeUint(call("threshold", Collections.emptyList())).longValueExact();
    }

    @Override
    public long getExpirationPeriod() {
        return decodeUint(call("EXPIRATION_PERIOD", Collections.emptyList())).longValueExact();
    }

    @Override
    public long getTransactionCount() {
        return decodeUint(call("getTransactionCount", Collections.emptyList())).longValueExact();
    }

    @Override
    public BigInteger getBalance() {
        return decodeUint(call("getBalance", Collections.emptyList()));
    }

    @Override
    public String getToken() {
        return decodeAddress(call("usdt", Collections.emptyList()));
    }

    @Override
    public OnChainProposal getTransaction(long id) {
        if (id < 0 || id >= getTransactionCount()) {
            throw MultisigException.notFound("Proposal", id);
        }
        return decodeTransaction(id, call("getTransaction", List.of(new Uint256(BigInteger.valueOf(id)))));
    }

    @Override
    public boolean isApproved(long id, String owner) {
        return decodeBool(call("isApproved", List.of(new Uint256(BigInteger.valueOf(id)), abiAddress(owner))));
    }

    @Override
    public boolean isOwner(String address) {
        return decodeBool(call("isOwner", List.of(abiAddress(address))));
    }

    @Override
    public boolean isExpired(long id) {
        return decodeBool(call("isExpired", List.of(new Uint256(BigInteger.valueOf(id)))));
    }

    @SuppressWarnings("rawtypes")
    private String call(String functionName, List<Type> inputs) {
        Function fn = new Function(functionName, inputs, Collections.emptyList());
        Response.TransactionExtention txn;
        try {
            txn = node.wrapper().triggerConstantContract(
                    node.getOwnerAddress(),
                    contractAddress,
                    FunctionEncoder.encode(fn),
                    NodeType.SOLIDITY_NODE
            );
        } catch (MultisigException e) {
            throw e;
        } catch (Exception e) {
            log.error("{} query failed", functionName, e);
            throw new MultisigException(FailureReason.NETWORK_FAILURE, functionName + " failed: " + e.getMessage(), e);
        }
        if (!txn.getResult().getResult()) {
            throw new MultisigException(FailureReason.NETWORK_FAILURE,
                    functionName + " failed: " + txn.getResult().getMessage().toStringUtf8());
        }
        if (txn.getConstantResultCount() == 0) {
            throw new MultisigException(FailureReason.NETWORK_FAILURE, "No constantResult for " + functionName);
        }
        return Numeric.toHexString(txn.getConstantResult(0).toByteArray());
    }

    private static Address abiAddress(String address) {
        return new Address(new BigInteger(1, TronAddresses.accountId(address)));
    }

    // ---- decoding ----

    /**
     * Decode getTransaction(uint256) output:
     * 0: address to
     * 1: uint256 amount
     * 2: bool executed
     * 3: uint256 approvalCount
     * 4: uint256 createdAt (unix seconds)
     */
    public static OnChainProposal decodeTransaction(long id, String resultHex) {
        List<org.web3j.abi.datatypes.Type<?>> decoded = decodeWeb3Abi(
                resultHex,
                new TypeReference<org.web3j.abi.datatypes.Address>() {},
                new TypeReference<org.web3j.abi.datatypes.generated.Uint256>() {},
                new TypeReference<Bool>() {},
                new TypeReference<org.web3j.abi.datatypes.generated.Uint256>() {},
                new TypeReference<org.web3j.abi.datatypes.generated.Uint256>() {}
        );
        requireDecodedSize(decoded, 5);
        return new OnChainProposal(
                id,
                toTronAddress((org.web3j.abi.datatypes.Address) decoded.get(0)),
                ((org.web3j.abi.datatypes.generated.Uint256) decoded.get(1)).getValue(),
                ((Bool) decoded.get(2)).getValue(),
                ((org.web3j.abi.datatypes.generated.Uint256) decoded.get(3)).getValue().longValueExact(),
                ((org.web3j.abi.datatypes.generated.Uint256) decoded.get(4)).getValue().longValueExact()
        );
    }

    public static List<String> decodeAddressArray(String resultHex) {
        List<org.web3j.abi.datatypes.Type<?>> decoded = decodeWeb3Abi(
                resultHex,
                new TypeReference<DynamicArray<org.web3j.abi.datatypes.Address>>() {}
        );
        requireDecodedSize(decoded, 1);
        @SuppressWarnings("unchecked")
        DynamicArray<org.web3j.abi.datatypes.Address> array =
                (DynamicArray<org.web3j.abi.datatypes.Address>) decoded.get(0);
        List<String> addresses = new ArrayList<>();
        for (org.web3j.abi.datatypes.Address a : array.getValue()) {
            addresses.add(toTronAddress(a));
        }
        return addresses;
    }

    public static BigInteger decodeUint(String resultHex) {
        List<org.web3j.abi.datatypes.Type<?>> decoded = decodeWeb3Abi(
                resultHex, new TypeReference<org.web3j.abi.datatypes.generated.Uint256>() {});
        requireDecodedSize(decoded, 1);
        return ((org.web3j.abi.datatypes.generated.Uint256) decoded.get(0)).getValue();
    }

    public static boolean decodeBool(String resultHex) {
        List<org.web3j.abi.datatypes.Type<?>> decoded = decodeWeb3Abi(resultHex, new TypeReference<Bool>() {});
        requireDecodedSize(decoded, 1);
        return ((Bool) decoded.get(0)).getValue();
    }

    public static String decodeAddress(String resultHex) {
        List<org.web3j.abi.datatypes.Type<?>> decoded = decodeWeb3Abi(
                resultHex, new TypeReference<org.web3j.abi.datatypes.Address>() {});
        requireDecodedSize(decoded, 1);
        return toTronAddress((org.web3j.abi.datatypes.Address) decoded.get(0));
    }

    private static String toTronAddress(org.web3j.abi.datatypes.Address address) {
        return TronAddresses.encode(Numeric.hexStringToByteArray(address.getValue()));
    }

    private static void requireDecodedSize(List<?> decoded, int expected) {
        if (decoded.size() != expected) {
            throw new IllegalStateException("Unexpected decoded outputs=" + decoded.size() + ", expected=" + expected);
        }
    }

    private static List<org.web3j.abi.datatypes.Type<?>> decodeWeb3Abi(String dataHex, TypeReference<?>... outputs) {
        String hex = (dataHex.startsWith("0x") || dataHex.startsWith("0X")) ? dataHex : "0x" + dataHex;

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<TypeReference<org.web3j.abi.datatypes.Type>> typed = (List) Arrays.asList(outputs);

        @SuppressWarnings({"rawtypes", "unchecked"})
        List<org.web3j.abi.datatypes.Type<?>> decoded = (List) FunctionReturnDecoder.decode(hex, typed);
        return decoded;
    }
}
