package dao.tron.msig.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "contract")
@Data
public class ContractProperties {

    /**
     * Deployed multisig vault contract address (base58 format)
     */
    private String address;

    /**
     * Fee limit for contract calls, in SUN
     * Default: 100_000_000 (100 TRX)
     */
    private long feeLimit = 100_000_000L;
}
