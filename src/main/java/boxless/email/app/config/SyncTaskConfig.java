package boxless.email.app.config;

import boxless.email.app.queue.DurableTaskQueue;
import boxless.email.app.queue.GoogleCloudTasksQueue;
import com.google.cloud.tasks.v2.CloudTasksClient;
import com.google.cloud.tasks.v2.QueueName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Clock;

/**
 * Wires the durable task backend. Set sync.backend=durable-queue to enqueue Cloud Tasks;
 * otherwise no queue bean exists and the dispatcher runs syncs inline.
 */
@Slf4j
@Configuration
public class SyncTaskConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    @Conditional(DurableQueueBackendCondition.class)
    public CloudTasksClient cloudTasksClient() throws IOException {
        return CloudTasksClient.create();
    }

    @Bean
    @Conditional(DurableQueueBackendCondition.class)
    public DurableTaskQueue durableTaskQueue(CloudTasksClient cloudTasksClient, SyncProperties properties) {
        SyncProperties.Queue queue = properties.getQueue();
        if (queue.getProjectId() == null || queue.getProjectId().isEmpty()) {
            throw new IllegalStateException("sync.backend=durable-queue requires sync.queue.project-id");
        }
        QueueName queueName = QueueName.of(queue.getProjectId(), queue.getLocation(), queue.getQueueName());
        log.info("Sync tasks will be enqueued on {}", queueName);
        return new GoogleCloudTasksQueue(cloudTasksClient, queueName);
    }
}
