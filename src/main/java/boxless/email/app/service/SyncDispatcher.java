package boxless.email.app.service;

import boxless.email.app.config.SyncBackend;
import boxless.email.app.config.SyncProperties;
import boxless.email.app.entity.User;
import boxless.email.app.queue.DurableTaskQueue;
import boxless.email.app.repository.UserRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Hands per-user syncs to the configured backend: inline in this thread, or as a delayed
 * Cloud Tasks callback to {@code POST /tasks/sync-user}. The backend is fixed at construction.
 */
@Slf4j
@Service
public class SyncDispatcher {
    private final SyncBackend backend;
    private final Duration staggerStride;
    private final String callbackUrl;
    private final EmailSyncService emailSyncService;
    private final UserRepository userRepository;
    private final DurableTaskQueue taskQueue;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public SyncDispatcher(
            SyncProperties properties,
            EmailSyncService emailSyncService,
            UserRepository userRepository,
            ObjectProvider<DurableTaskQueue> taskQueue,
            ObjectMapper objectMapper,
            Clock clock) {
        this(properties, emailSyncService, userRepository, taskQueue.getIfAvailable(), objectMapper, clock);
    }

    public SyncDispatcher(
            SyncProperties properties,
            EmailSyncService emailSyncService,
            UserRepository userRepository,
            DurableTaskQueue taskQueue,
            ObjectMapper objectMapper,
            Clock clock) {
        this.backend = properties.getBackend();
        if (backend == SyncBackend.DURABLE_QUEUE && taskQueue == null) {
            throw new IllegalStateException("sync.backend=durable-queue but no task queue is configured");
        }
        this.staggerStride = properties.getStaggerStride();
        this.callbackUrl = properties.getQueue().resolveCallbackUrl();
        this.emailSyncService = emailSyncService;
        this.userRepository = userRepository;
        this.taskQueue = taskQueue;
        this.objectMapper = objectMapper;
        this.clock = clock;
        log.info("Sync dispatcher using {} backend", backend);
    }

    /**
     * Schedule one user's sync. Inline mode runs it now and ignores the delay.
     * @return the task handle, or null when the sync ran inline
     */
    public String schedule(Long userId, long delaySeconds) {
        if (backend == SyncBackend.INLINE) {
            SyncResult result = emailSyncService.runUserSync(userId);
            log.info("Inline sync for user {} finished with status {}", userId, result.getStatus());
            return null;
        }

        Instant notBefore = delaySeconds > 0 ? Instant.now(clock).plusSeconds(delaySeconds) : null;
        String taskName = taskQueue.enqueue(callbackUrl, payloadFor(userId), notBefore);
        log.info("Scheduled sync task for user {}: {}", userId, taskName);
        return taskName;
    }

    /**
     * Schedule every active user holding an access token, the i-th one delayed by i strides.
     * A user whose scheduling fails is logged and skipped.
     * @return number of users scheduled
     */
    public int scheduleAllActive() {
        List<User> users = userRepository.findSyncableUsers();
        log.info("Starting background sync for {} users", users.size());

        int scheduled = 0;
        for (int i = 0; i < users.size(); i++) {
            Long userId = users.get(i).getId();
            long delaySeconds = staggerStride.getSeconds() * i;
            try {
                schedule(userId, delaySeconds);
                scheduled++;
            } catch (Exception e) {
                log.error("Failed to schedule sync for user {}: {}", userId, e.getMessage(), e);
            }
        }
        return scheduled;
    }

    public SyncBackend getBackend() {
        return backend;
    }

    private byte[] payloadFor(Long userId) {
        try {
            return objectMapper.writeValueAsBytes(Map.of("user_id", userId));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode sync task payload for user " + userId, e);
        }
    }
}
