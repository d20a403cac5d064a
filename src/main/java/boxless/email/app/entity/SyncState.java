package boxless.email.app.entity;

public enum SyncState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
