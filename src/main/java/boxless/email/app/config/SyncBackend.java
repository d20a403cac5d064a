package boxless.email.app.config;

/**
 * Where {@code SyncDispatcher} sends per-user sync work.
 */
public enum SyncBackend {
    /** Run the sync in the calling thread. Local development and tests. */
    INLINE,
    /** Enqueue a Cloud Tasks HTTP callback per user. */
    DURABLE_QUEUE
}
