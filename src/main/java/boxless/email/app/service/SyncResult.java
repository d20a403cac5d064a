package boxless.email.app.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Outcome of one sync run. Failures are reported here rather than thrown, so callers branch on
 * {@link #isFailed()}. Counts are rows created by this run.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncResult {
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    Long userId;
    String status;
    Integer emailsSynced;
    Integer labelsSynced;
    String error;

    public static SyncResult completed(Long userId, int emailsSynced, int labelsSynced) {
        return new SyncResult(userId, COMPLETED, emailsSynced, labelsSynced, null);
    }

    public static SyncResult failed(Long userId, String error) {
        return new SyncResult(userId, FAILED, null, null, error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return FAILED.equals(status);
    }
}
