package boxless.email.app.service;

import boxless.email.app.entity.SyncStatus;
import lombok.Value;

import java.time.Instant;

/**
 * Read model of a user's sync status. {@code status} is one of never_synced, pending, running,
 * completed or failed.
 */
@Value
public class SyncStatusView {
    public static final String NEVER_SYNCED = "never_synced";

    Long userId;
    String status;
    Instant lastSync;
    Integer emailsSynced;
    String errorMessage;

    public static SyncStatusView neverSynced(Long userId) {
        return new SyncStatusView(userId, NEVER_SYNCED, null, null, null);
    }

    public static SyncStatusView of(Long userId, SyncStatus status) {
        return new SyncStatusView(userId, status.getStatus().name().toLowerCase(),
                status.getLastSync(), status.getEmailsSynced(), status.getErrorMessage());
    }
}
