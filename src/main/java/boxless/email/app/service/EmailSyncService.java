package boxless.email.app.service;

import boxless.email.app.config.SyncProperties;
import boxless.email.app.entity.SyncState;
import boxless.email.app.entity.User;
import boxless.email.app.provider.MailProviderClient;
import boxless.email.app.provider.MailProviderClientFactory;
import boxless.email.app.provider.MessagePage;
import boxless.email.app.provider.ProviderCredentials;
import boxless.email.app.provider.ProviderLabel;
import boxless.email.app.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Runs one user's mailbox sync: labels once, then recent messages page by page.
 *
 * <p>A page that fails stops paging but keeps what earlier pages stored, and the run still
 * completes with the partial count. Any other failure marks the run failed. Either way the
 * caller gets a {@link SyncResult}, never an exception.
 */
@Slf4j
@Service
public class EmailSyncService {
    private final UserRepository userRepository;
    private final SyncStatusService syncStatusService;
    private final EmailReconciliationService reconciliationService;
    private final TokenRefreshService tokenRefreshService;
    private final MailProviderClientFactory clientFactory;
    private final SyncProperties properties;

    public EmailSyncService(
            UserRepository userRepository,
            SyncStatusService syncStatusService,
            EmailReconciliationService reconciliationService,
            TokenRefreshService tokenRefreshService,
            MailProviderClientFactory clientFactory,
            SyncProperties properties) {
        this.userRepository = userRepository;
        this.syncStatusService = syncStatusService;
        this.reconciliationService = reconciliationService;
        this.tokenRefreshService = tokenRefreshService;
        this.clientFactory = clientFactory;
        this.properties = properties;
    }

    public SyncResult runUserSync(Long userId) {
        log.info("Starting sync for user {}", userId);
        try {
            syncStatusService.update(userId, SyncState.RUNNING, null, "");

            User user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
            if (!user.hasAccessToken()) {
                throw new SyncPreconditionException("User " + userId + " has no access token");
            }

            ProviderCredentials credentials = tokenRefreshService.ensureFreshCredentials(user);
            MailProviderClient client = clientFactory.create(credentials);

            List<ProviderLabel> labels = client.listLabels();
            LabelReconcileResult labelResult = reconciliationService.reconcileLabels(userId, labels);
            log.info("Synced labels for user {}: {} of {} created", userId, labelResult.getCreated(), labelResult.getTotal());

            int emailsSynced = syncMessagePages(userId, client);

            syncStatusService.update(userId, SyncState.COMPLETED, emailsSynced, null);
            log.info("Completed sync for user {}: {} emails", userId, emailsSynced);
            return SyncResult.completed(userId, emailsSynced, labelResult.getCreated());
        } catch (Exception e) {
            String errorMessage = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Sync failed for user {}: {}", userId, errorMessage, e);
            recordFailure(userId, errorMessage);
            return SyncResult.failed(userId, errorMessage);
        }
    }

    private int syncMessagePages(Long userId, MailProviderClient client) {
        String query = properties.recencyQuery();
        int maxMessages = properties.getMaxMessages();
        int created = 0;
        int fetched = 0;
        int pageNumber = 0;
        String pageToken = null;

        while (fetched < maxMessages) {
            pageNumber++;
            MessagePage page;
            try {
                page = client.listMessages(query, Math.min(properties.getPageSize(), maxMessages - fetched), null, pageToken);
                if (page.isEmpty()) {
                    break;
                }
                EmailReconcileResult result = reconciliationService.reconcileEmails(userId, page.getMessages());
                created += result.getCreated();
                fetched += result.getTotal();
                log.debug("Page {} for user {}: {} fetched, {} created", pageNumber, userId, result.getTotal(), result.getCreated());
            } catch (Exception e) {
                log.warn("Error syncing page {} for user {}, keeping {} emails from earlier pages: {}",
                    pageNumber, userId, created, e.getMessage(), e);
                break;
            }

            if (!page.hasNextPage() || fetched >= maxMessages) {
                break;
            }
            pageToken = page.getNextPageToken();
            if (!pauseBetweenPages(userId)) {
                break;
            }
        }
        return created;
    }

    private boolean pauseBetweenPages(Long userId) {
        Duration delay = properties.getPageDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Sync for user {} interrupted between pages", userId);
            return false;
        }
    }

    private void recordFailure(Long userId, String errorMessage) {
        try {
            syncStatusService.update(userId, SyncState.FAILED, null, errorMessage);
        } catch (Exception statusError) {
            // Last place the failure can be seen when the status row cannot be written.
            log.error("SYNC_STATUS_UNRECORDED userId={} status={} error=\"{}\" statusError=\"{}\"",
                userId, SyncState.FAILED, errorMessage, statusError.getMessage(), statusError);
        }
    }
}
