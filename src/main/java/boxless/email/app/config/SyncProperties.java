package boxless.email.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Sync engine tuning.
 *
 * <pre>{@code
 * sync.backend=inline            # or durable-queue
 * sync.page-size=100
 * sync.max-messages=1000
 * sync.recency-days=30
 * sync.page-delay=1s
 * sync.stagger-stride=30s
 * sync.retention=7d
 * sync.queue.project-id=my-project
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {
    private SyncBackend backend = SyncBackend.INLINE;

    /** Messages requested per provider page. */
    private int pageSize = 100;

    /** Upper bound on messages fetched in one run. */
    private int maxMessages = 1000;

    /** Only messages newer than this many days are fetched. */
    private int recencyDays = 30;

    private Duration pageDelay = Duration.ofSeconds(1);

    /** Delay added per user when scheduling all active users. */
    private Duration staggerStride = Duration.ofSeconds(30);

    /** Sync status rows whose last sync is older than this are purged. */
    private Duration retention = Duration.ofDays(7);

    private Queue queue = new Queue();

    @Data
    public static class Queue {
        private String projectId;
        private String location = "us-central1";
        private String queueName = "email-sync-queue";
        /** Defaults to the App Engine URL of the project when unset. */
        private String callbackUrl;

        public String resolveCallbackUrl() {
            if (callbackUrl != null && !callbackUrl.isEmpty()) {
                return callbackUrl;
            }
            return "https://" + projectId + ".appspot.com/tasks/sync-user";
        }
    }

    public String recencyQuery() {
        return "newer_than:" + recencyDays + "d";
    }
}
