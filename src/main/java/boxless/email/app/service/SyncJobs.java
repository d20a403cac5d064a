package boxless.email.app.service;

import boxless.email.app.config.SyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic triggers for the sync engine. Enabled with sync.schedule.enabled=true.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "sync.schedule.enabled", havingValue = "true")
public class SyncJobs {
    private final SyncDispatcher syncDispatcher;
    private final SyncStatusService syncStatusService;
    private final SyncProperties properties;

    public SyncJobs(SyncDispatcher syncDispatcher, SyncStatusService syncStatusService, SyncProperties properties) {
        this.syncDispatcher = syncDispatcher;
        this.syncStatusService = syncStatusService;
        this.properties = properties;
    }

    @Scheduled(cron = "${sync.schedule.sync-all-cron:0 0 * * * *}")
    public void syncAllActiveUsers() {
        try {
            int scheduled = syncDispatcher.scheduleAllActive();
            log.info("Periodic sync scheduled {} users", scheduled);
        } catch (Exception e) {
            log.error("Error in periodic sync scheduling: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${sync.schedule.cleanup-cron:0 30 3 * * *}")
    public void purgeOldSyncStatuses() {
        try {
            syncStatusService.purgeOlderThan(properties.getRetention());
        } catch (Exception e) {
            log.error("Error purging old sync statuses: {}", e.getMessage(), e);
        }
    }
}
