package dao.tron.msig.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private ReconcileConfig reconcile = new ReconcileConfig();

    @Data
    public static class ReconcileConfig {
        /**
         * Enable/disable periodic reconciliation of pending transactions
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to reconcile (in milliseconds)
         * Default: 30000ms (30 seconds)
         */
        private long checkIntervalMs = 30_000;
    }
}
