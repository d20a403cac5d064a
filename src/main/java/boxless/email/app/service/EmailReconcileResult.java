package boxless.email.app.service;

import lombok.Value;

/**
 * Outcome of reconciling one batch of messages. {@code updated} counts records that were
 * already stored; their rows are left unchanged.
 */
@Value
public class EmailReconcileResult {
    int created;
    int updated;
    int total;
}
