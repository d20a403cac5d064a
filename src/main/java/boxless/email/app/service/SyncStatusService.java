package boxless.email.app.service;

import boxless.email.app.entity.SyncState;
import boxless.email.app.entity.SyncStatus;
import boxless.email.app.entity.User;
import boxless.email.app.repository.SyncStatusRepository;
import boxless.email.app.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-user sync lifecycle: PENDING, then RUNNING, then COMPLETED or FAILED. Both end states
 * may go back to RUNNING on the next run. Each call commits on its own.
 */
@Slf4j
@Service
public class SyncStatusService {
    private final SyncStatusRepository syncStatusRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    public SyncStatusService(SyncStatusRepository syncStatusRepository, UserRepository userRepository, Clock clock) {
        this.syncStatusRepository = syncStatusRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Transactional
    public SyncStatus create(Long userId) {
        return syncStatusRepository.findByUserId(userId)
                .orElseGet(() -> syncStatusRepository.save(newStatus(userId)));
    }

    /**
     * Patch the status row of a user, creating it if missing.
     * @param emailsSynced replaces the stored count when not null
     * @param errorMessage replaces the stored error when not null; an empty string clears it
     */
    @Transactional
    public SyncStatus update(Long userId, SyncState state, Integer emailsSynced, String errorMessage) {
        SyncStatus syncStatus = syncStatusRepository.findByUserId(userId)
                .orElseGet(() -> newStatus(userId));

        syncStatus.setStatus(state);
        syncStatus.setLastSync(Instant.now(clock));
        if (emailsSynced != null) {
            syncStatus.setEmailsSynced(emailsSynced);
        }
        if (errorMessage != null) {
            syncStatus.setErrorMessage(errorMessage.isEmpty() ? null : errorMessage);
        }
        return syncStatusRepository.save(syncStatus);
    }

    @Transactional(readOnly = true)
    public SyncStatusView read(Long userId) {
        return syncStatusRepository.findByUserId(userId)
                .map(status -> SyncStatusView.of(userId, status))
                .orElseGet(() -> SyncStatusView.neverSynced(userId));
    }

    /**
     * Delete status rows whose last sync is older than {@code age}. Rows that never ran are kept.
     * @return number of rows deleted
     */
    @Transactional
    public int purgeOlderThan(Duration age) {
        Instant cutoff = Instant.now(clock).minus(age);
        int deleted = syncStatusRepository.deleteByLastSyncBefore(cutoff);
        log.info("Purged {} sync status rows last synced before {}", deleted, cutoff);
        return deleted;
    }

    private SyncStatus newStatus(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
        SyncStatus syncStatus = new SyncStatus();
        syncStatus.setUser(user);
        syncStatus.setStatus(SyncState.PENDING);
        return syncStatus;
    }
}
