package dao.tron.msig.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "node")
@Data
public class NodeProperties {

    /**
     * Trident network preset: nile, shasta, mainnet or custom
     * Default: nile
     */
    private String network = "nile";

    /**
     * Full node gRPC endpoint, only used when network=custom
     * Example: grpc.nile.trongrid.io:50051
     */
    private String grpcEndpoint;

    /**
     * Solidity node gRPC endpoint, only used when network=custom
     * Example: grpc.nile.trongrid.io:50061
     */
    private String grpcSolidityEndpoint;

    /**
     * TronGrid API key (mainnet only)
     */
    private String apiKey;

    /**
     * Local custodian private key (hex format, 64 characters)
     */
    private String privateKey;

    /**
     * Receipt polling settings for contract calls.
     */
    private Polling polling = new Polling();

    @Data
    public static class Polling {
        /**
         * Timeout for getting TransactionInfo after broadcasting a tx.
         */
        private long txInfoTimeoutSeconds = 60;
        /**
         * Initial poll interval for TransactionInfo.
         */
        private long txInfoPollInitialMs = 250;
        /**
         * Maximum poll interval for TransactionInfo (backoff cap).
         */
        private long txInfoPollMaxMs = 2000;
    }
}
