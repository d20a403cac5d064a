package boxless.email.app.queue;

import com.google.cloud.tasks.v2.CloudTasksClient;
import com.google.cloud.tasks.v2.HttpMethod;
import com.google.cloud.tasks.v2.HttpRequest;
import com.google.cloud.tasks.v2.QueueName;
import com.google.cloud.tasks.v2.Task;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

@Slf4j
public class GoogleCloudTasksQueue implements DurableTaskQueue {
    private final CloudTasksClient client;
    private final QueueName queueName;

    public GoogleCloudTasksQueue(CloudTasksClient client, QueueName queueName) {
        this.client = client;
        this.queueName = queueName;
    }

    @Override
    public String enqueue(String targetUrl, byte[] payload, Instant notBefore) {
        Task created = client.createTask(queueName, buildTask(targetUrl, payload, notBefore));
        log.debug("Created task {} for {} (not before {})", created.getName(), targetUrl, notBefore);
        return created.getName();
    }

    Task buildTask(String targetUrl, byte[] payload, Instant notBefore) {
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .setUrl(targetUrl)
                .setHttpMethod(HttpMethod.POST)
                .putHeaders("Content-Type", "application/json")
                .setBody(ByteString.copyFrom(payload))
                .build();

        Task.Builder task = Task.newBuilder().setHttpRequest(httpRequest);
        if (notBefore != null) {
            task.setScheduleTime(Timestamp.newBuilder()
                    .setSeconds(notBefore.getEpochSecond())
                    .setNanos(notBefore.getNano())
                    .build());
        }
        return task.build();
    }
}
