package dao.tron.msig.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "vault")
@Data
public class VaultProperties {

    /**
     * Run the in-process approval vault. Requires owners, threshold and token.
     * Default: false
     */
    private boolean enabled = false;

    /**
     * Custodian addresses (base58), in roster order
     */
    private List<String> owners = new ArrayList<>();

    /**
     * Approvals required before a proposal executes
     */
    private int threshold = 1;

    /**
     * Seconds after submission during which a proposal may still be approved
     * Default: 86400 (one day)
     */
    private long expirationPeriodSeconds = 86_400;

    /**
     * TRC20 token contract the vault spends (base58)
     * Example: TXYZopYRdj2D9XRtbG411XZZ3kM5VkAeBf (USDT on Nile)
     */
    private String tokenAddress;

    /**
     * Fee limit for token transfers, in SUN
     * Default: 100_000_000 (100 TRX)
     */
    private long feeLimit = 100_000_000L;
}
