package dao.tron.msig.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.tron.msig.gateway.TronNode;
import dao.tron.msig.model.CustodianRoster;
import dao.tron.msig.repository.FilePendingTransactionStore;
import dao.tron.msig.repository.InMemoryPendingTransactionStore;
import dao.tron.msig.repository.PendingTransactionStore;
import dao.tron.msig.vault.CustodyVault;
import dao.tron.msig.vault.Trc20TokenLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class CustodyConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PendingTransactionStore pendingTransactionStore(CoordinatorProperties props, ObjectMapper mapper) {
        CoordinatorProperties.Store store = props.getStore();
        if ("memory".equalsIgnoreCase(store.getType())) {
            log.info("Pending transactions kept in memory only");
            return new InMemoryPendingTransactionStore();
        }
        return new FilePendingTransactionStore(Path.of(store.getPath()), mapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "vault", name = "enabled", havingValue = "true")
    public CustodyVault custodyVault(VaultProperties props,
                                     TronNode node,
                                     Clock clock,
                                     ApplicationEventPublisher publisher) {
        CustodianRoster roster = CustodianRoster.of(props.getOwners(), props.getThreshold());
        Trc20TokenLedger ledger = new Trc20TokenLedger(node, props.getTokenAddress(), props.getFeeLimit());
        return new CustodyVault(roster, ledger, Duration.ofSeconds(props.getExpirationPeriodSeconds()), clock, publisher);
    }
}
