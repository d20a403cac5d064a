package boxless.email.app.provider;

/**
 * Thrown when a call to the mail provider fails outside a sync run.
 */
public class MailProviderException extends RuntimeException {
    public MailProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
