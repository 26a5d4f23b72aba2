package dao.tron.msig.util;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import org.tron.trident.proto.Chain;
import org.tron.trident.proto.Contract;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Helpers over TRON transaction payloads.
 * <p>
 * Signature layout is r(32) || s(32) || recId(1), computed over the txId itself.
 * A signer is whoever the signature recovers to; signatures that recover to nobody
 * are carried along but never counted.
 */
public final class TronTransactions {
    private TronTransactions() {}

    public static final int SIGNATURE_LENGTH = 65;

    /** Selector of {@code transfer(address,uint256)}. */
    private static final byte[] TRC20_TRANSFER_SELECTOR = {(byte) 0xa9, 0x05, (byte) 0x9c, (byte) 0xbb};
    private static final int ABI_WORD = 32;

    /**
     * What a payload actually moves. {@code asset} is "TRX" or the token contract address.
     */
    public record TransferTerms(String from, String to, BigInteger amount, String asset) {}

    public static Chain.Transaction parse(byte[] payload) {
        try {
            Chain.Transaction tx = Chain.Transaction.parseFrom(payload);
            if (!tx.hasRawData() || tx.getRawData().getContractCount() == 0) {
                throw new IllegalArgumentException("Transaction payload has no contract");
            }
            return tx;
        } catch (InvalidProtocolBufferException e) {
            throw new IllegalArgumentException("Malformed transaction payload: " + e.getMessage(), e);
        }
    }

    /**
     * Reads sender, recipient, amount and asset out of a single TRX transfer or TRC20
     * {@code transfer(address,uint256)} call.
     *
     * @throws IllegalArgumentException for any other kind of transaction
     */
    public static TransferTerms transferTerms(Chain.Transaction tx) {
        if (tx.getRawData().getContractCount() != 1) {
            throw new IllegalArgumentException("Expected exactly one contract, found " + tx.getRawData().getContractCount());
        }
        Chain.Transaction.Contract contract = tx.getRawData().getContract(0);
        try {
            switch (contract.getType()) {
                case TransferContract: {
                    Contract.TransferContract transfer =
                            Contract.TransferContract.parseFrom(contract.getParameter().getValue());
                    return new TransferTerms(
                            TronAddresses.encode(transfer.getOwnerAddress().toByteArray()),
                            TronAddresses.encode(transfer.getToAddress().toByteArray()),
                            BigInteger.valueOf(transfer.getAmount()),
                            "TRX");
                }
                case TriggerSmartContract: {
                    Contract.TriggerSmartContract call =
                            Contract.TriggerSmartContract.parseFrom(contract.getParameter().getValue());
                    byte[] data = call.getData().toByteArray();
                    if (data.length != TRC20_TRANSFER_SELECTOR.length + 2 * ABI_WORD
                            || !Arrays.equals(Arrays.copyOf(data, TRC20_TRANSFER_SELECTOR.length), TRC20_TRANSFER_SELECTOR)) {
                        throw new IllegalArgumentException("Contract call is not transfer(address,uint256)");
                    }
                    int addressWord = TRC20_TRANSFER_SELECTOR.length;
                    int amountWord = addressWord + ABI_WORD;
                    byte[] to = Arrays.copyOfRange(data, amountWord - 20, amountWord);
                    BigInteger amount = new BigInteger(1, Arrays.copyOfRange(data, amountWord, amountWord + ABI_WORD));
                    return new TransferTerms(
                            TronAddresses.encode(call.getOwnerAddress().toByteArray()),
                            TronAddresses.encode(to),
                            amount,
                            TronAddresses.encode(call.getContractAddress().toByteArray()));
                }
                default:
                    throw new IllegalArgumentException("Unsupported contract type " + contract.getType());
            }
        } catch (InvalidProtocolBufferException e) {
            throw new IllegalArgumentException("Malformed contract parameter: " + e.getMessage(), e);
        }
    }

    public static byte[] txId(Chain.Transaction tx) {
        return CryptoUtil.sha256(tx.getRawData().toByteArray());
    }

    public static String txIdHex(Chain.Transaction tx) {
        return CryptoUtil.toHex(txId(tx));
    }

    /**
     * Pushes the expiration out by {@code extensionMillis} and stamps every contract with
     * the permission id. Changing raw_data changes the txId, so existing signatures are dropped.
     */
    public static Chain.Transaction prepare(Chain.Transaction tx, long extensionMillis, int permissionId) {
        var raw = tx.getRawData().toBuilder()
                .setExpiration(tx.getRawData().getExpiration() + extensionMillis);
        for (int i = 0; i < raw.getContractCount(); i++) {
            raw.setContract(i, raw.getContract(i).toBuilder().setPermissionId(permissionId));
        }
        return Chain.Transaction.newBuilder().setRawData(raw).build();
    }

    public static byte[] sign(byte[] txId, ECKeyPair keyPair) {
        Sign.SignatureData sd = Sign.signMessage(txId, keyPair, false);
        byte[] signature = new byte[SIGNATURE_LENGTH];
        System.arraycopy(sd.getR(), 0, signature, 0, 32);
        System.arraycopy(sd.getS(), 0, signature, 32, 32);
        signature[64] = (byte) (sd.getV()[0] - 27);
        return signature;
    }

    public static Chain.Transaction addSignature(Chain.Transaction tx, byte[] signature) {
        return tx.toBuilder().addSignature(ByteString.copyFrom(signature)).build();
    }

    public static Optional<String> recoverSigner(byte[] txId, byte[] signature) {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            return Optional.empty();
        }
        byte v = signature[64];
        if (v < 27) v += 27;
        Sign.SignatureData data = new Sign.SignatureData(
                v,
                Arrays.copyOfRange(signature, 0, 32),
                Arrays.copyOfRange(signature, 32, 64));
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(txId, data);
            return Optional.of(TronAddresses.fromPublicKey(publicKey));
        } catch (SignatureException | RuntimeException e) {
            return Optional.empty();
        }
    }

    /** Distinct signer addresses, in the order their first signature appears. */
    public static List<String> recoverSigners(Chain.Transaction tx) {
        byte[] txId = txId(tx);
        Set<String> signers = new LinkedHashSet<>();
        for (ByteString sig : tx.getSignatureList()) {
            recoverSigner(txId, sig.toByteArray()).ifPresent(signers::add);
        }
        return new ArrayList<>(signers);
    }

    /**
     * Adds to {@code base} every signature of {@code incoming} whose signer is not already
     * represented. Both must carry the same raw_data.
     */
    public static Chain.Transaction mergeSignatures(Chain.Transaction base, Chain.Transaction incoming) {
        byte[] txId = txId(base);
        if (!Arrays.equals(txId, txId(incoming))) {
            throw new IllegalArgumentException("Cannot merge signatures of different transactions");
        }
        Set<String> present = new LinkedHashSet<>(recoverSigners(base));
        Chain.Transaction.Builder merged = base.toBuilder();
        for (ByteString sig : incoming.getSignatureList()) {
            Optional<String> signer = recoverSigner(txId, sig.toByteArray());
            if (signer.isPresent() && present.add(signer.get())) {
                merged.addSignature(sig);
            }
        }
        return merged.build();
    }
}
