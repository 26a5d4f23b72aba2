package dao.tron.msig.service;

import dao.tron.msig.config.NodeProperties;
import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.util.TronAddresses;
import dao.tron.msig.util.TronTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.crypto.ECKeyPair;

import java.math.BigInteger;

/**
 * The local custodian's signing key.
 */
@Slf4j
@Component
public class LocalSigner {

    private final ECKeyPair keyPair;
    private final String address;

    @Autowired
    public LocalSigner(NodeProperties props) {
        this(parseKey(props.getPrivateKey()));
    }

    public LocalSigner(ECKeyPair keyPair) {
        this.keyPair = keyPair;
        this.address = keyPair == null ? null : TronAddresses.fromPublicKey(keyPair.getPublicKey());
    }

    private static ECKeyPair parseKey(String privateKey) {
        if (privateKey == null || privateKey.isBlank() || privateKey.equals("YOUR_PRIVATE_KEY_HERE")) {
            log.warn("No local custodian key configured; signing is disabled.");
            return null;
        }
        String hex = privateKey.startsWith("0x") ? privateKey.substring(2) : privateKey;
        try {
            return ECKeyPair.create(new BigInteger(hex, 16));
        } catch (NumberFormatException e) {
            log.error("Invalid private key format: not hex");
            return null;
        }
    }

    public boolean isConfigured() {
        return keyPair != null;
    }

    public String address() {
        requireConfigured();
        return address;
    }

    public byte[] sign(byte[] txId) {
        requireConfigured();
        return TronTransactions.sign(txId, keyPair);
    }

    private void requireConfigured() {
        if (keyPair == null) {
            throw new MultisigException(FailureReason.NOT_AUTHORIZED, "No local custodian key configured");
        }
    }
}
