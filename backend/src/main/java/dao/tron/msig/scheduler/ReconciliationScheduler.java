package dao.tron.msig.scheduler;

import dao.tron.msig.config.SchedulerProperties;
import dao.tron.msig.service.PendingTransactionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ReconciliationScheduler {

    private final PendingTransactionService pendingService;
    private final SchedulerProperties schedulerProps;

    public ReconciliationScheduler(PendingTransactionService pendingService,
                                   SchedulerProperties schedulerProps) {
        this.pendingService = pendingService;
        this.schedulerProps = schedulerProps;
    }

    @Scheduled(fixedDelayString = "${scheduler.reconcile.check-interval-ms:30000}")
    public void reconcilePending() {
        if (!schedulerProps.getReconcile().isEnabled()) {
            return;
        }
        log.debug("Reconciling pending transactions");
        pendingService.reconcile();
    }
}
