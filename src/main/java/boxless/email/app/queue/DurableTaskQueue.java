package boxless.email.app.queue;

import java.time.Instant;

/**
 * An at-least-once queue of HTTP callbacks persisted outside this process.
 */
public interface DurableTaskQueue {
    /**
     * Enqueue a POST of {@code payload} to {@code targetUrl}.
     * @param targetUrl callback URL
     * @param payload JSON request body
     * @param notBefore earliest execution time, or null to run as soon as possible
     * @return backend handle of the created task
     */
    String enqueue(String targetUrl, byte[] payload, Instant notBefore);
}
