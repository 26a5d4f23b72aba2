package dao.tron.msig.gateway;

import dao.tron.msig.config.NodeProperties;
import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.proto.Chain;
import org.tron.trident.proto.Response;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Shared Trident connection signed with the local custodian key.
 * <p>
 * A missing or malformed key does not stop the application: the node stays unconfigured
 * and every network call fails with {@link FailureReason#NETWORK_FAILURE}.
 */
@Slf4j
@Component
public class TronNode {

    private final ApiWrapper wrapper;
    @Getter
    private final String ownerAddress;
    private final NodeProperties.Polling polling;
    /**
     * Guard signing/broadcasting so concurrent callers don't trip over non-thread-safe internals.
     * Receipt polling is done outside this lock.
     */
    private final Object broadcastLock = new Object();

    public TronNode(NodeProperties props) {
        this.polling = props.getPolling();

        String privateKey = props.getPrivateKey();
        if (privateKey == null || privateKey.isBlank() || privateKey.equals("YOUR_PRIVATE_KEY_HERE")) {
            log.warn("No valid private key configured. Set CUSTODIAN_PRIVATE_KEY to enable network operations.");
            this.wrapper = null;
            this.ownerAddress = null;
            return;
        }

        if (privateKey.length() % 2 != 0) {
            log.error("Invalid private key format: odd-length hex string");
            this.wrapper = null;
            this.ownerAddress = null;
            return;
        }

        ApiWrapper tempWrapper;
        String tempOwner;
        try {
            tempWrapper = connect(props, privateKey);
            tempOwner = tempWrapper.keyPair.toBase58CheckAddress();
            log.info("TronNode initialized: network={}, custodian={}", props.getNetwork(), tempOwner);
        } catch (Exception e) {
            log.error("Failed to initialize Trident wrapper: {}", e.getMessage());
            tempWrapper = null;
            tempOwner = null;
        }
        this.wrapper = tempWrapper;
        this.ownerAddress = tempOwner;
    }

    private static ApiWrapper connect(NodeProperties props, String privateKey) {
        String network = props.getNetwork() == null ? "nile" : props.getNetwork().toLowerCase();
        switch (network) {
            case "mainnet":
                return ApiWrapper.ofMainnet(privateKey, props.getApiKey());
            case "shasta":
                return ApiWrapper.ofShasta(privateKey);
            case "custom":
                return new ApiWrapper(props.getGrpcEndpoint(), props.getGrpcSolidityEndpoint(), privateKey);
            default:
                return ApiWrapper.ofNile(privateKey);
        }
    }

    public boolean isConfigured() {
        return wrapper != null;
    }

    public ApiWrapper wrapper() {
        if (wrapper == null) {
            throw new MultisigException(FailureReason.NETWORK_FAILURE, "TRON node is not configured");
        }
        return wrapper;
    }

    /**
     * Signs with the local key and broadcasts.
     *
     * @return network transaction id
     */
    public String signAndBroadcast(Response.TransactionExtention txnExt) {
        ApiWrapper api = wrapper();
        synchronized (broadcastLock) {
            Chain.Transaction signed = api.signTransaction(txnExt);
            return api.broadcastTransaction(signed);
        }
    }

    /**
     * Polls the receipt of a broadcast transaction and fails unless it executed successfully.
     */
    public Response.TransactionInfo awaitSuccess(String txId, String operation) {
        Response.TransactionInfo txInfo = waitForTxInfo(
                txId,
                Duration.ofSeconds(polling.getTxInfoTimeoutSeconds()),
                Duration.ofMillis(polling.getTxInfoPollInitialMs()),
                Duration.ofMillis(polling.getTxInfoPollMaxMs())
        );
        if (txInfo == null) {
            throw new MultisigException(FailureReason.NETWORK_FAILURE,
                    operation + " failed: no TransactionInfo after timeout. txId=" + txId);
        }
        if (txInfo.getResult() != Response.TransactionInfo.code.SUCESS) {
            String errorMsg = txInfo.getResMessage() != null ? txInfo.getResMessage().toStringUtf8() : "Unknown error";
            throw new MultisigException(FailureReason.TRANSFER_FAILED,
                    operation + " failed on-chain: " + errorMsg + ". txId=" + txId);
        }
        return txInfo;
    }

    private Response.TransactionInfo waitForTxInfo(String txId, Duration timeout, Duration pollInitial, Duration pollMax) {
        ApiWrapper api = wrapper();
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        long sleepMs = Math.max(100, pollInitial.toMillis());
        long maxSleepMs = Math.max(sleepMs, pollMax.toMillis());
        while (System.currentTimeMillis() < deadline) {
            try {
                Response.TransactionInfo info = api.getTransactionInfoById(txId);
                // an unconfirmed tx comes back as an empty message
                if (info != null && info.getBlockNumber() > 0) return info;
            } catch (Exception e) {
                log.debug("txInfo not available yet for {}: {}", txId, e.getMessage());
            }
            try {
                long jitter = ThreadLocalRandom.current().nextLong(0, 150);
                Thread.sleep(sleepMs + jitter);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return null;
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
        return null;
    }

    @PreDestroy
    public void close() {
        if (wrapper != null) {
            wrapper.close();
        }
    }
}
