package boxless.email.app.service;

/**
 * A sync cannot start for this user as stored, e.g. it holds no usable access token.
 * Retrying without changing the user's data will fail the same way.
 */
public class SyncPreconditionException extends RuntimeException {
    public SyncPreconditionException(String message) {
        super(message);
    }
}
