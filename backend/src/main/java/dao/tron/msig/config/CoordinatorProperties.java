package dao.tron.msig.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "coordinator")
@Data
public class CoordinatorProperties {

    /**
     * Native multi-key account the pending transactions spend from (base58)
     */
    private String accountAddress;

    /**
     * Seconds added to a freshly built transaction's expiration, giving custodians
     * time to collect signatures.
     * Default: 300
     */
    private long expirationExtensionSeconds = 300;

    /**
     * Fee limit for TRC20 transfers, in SUN
     * Default: 100_000_000 (100 TRX)
     */
    private long trc20FeeLimit = 100_000_000L;

    /**
     * Permission the transfers are signed under: 0 = owner, 2 = first active permission
     * Default: 0
     */
    private int permissionId = 0;

    private Store store = new Store();

    @Data
    public static class Store {
        /**
         * memory or file
         * Default: file
         */
        private String type = "file";

        /**
         * JSON file holding the pending set when type=file
         */
        private String path = "data/pending-transactions.json";
    }
}
