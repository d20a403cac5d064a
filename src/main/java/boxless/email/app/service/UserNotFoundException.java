package boxless.email.app.service;

public class UserNotFoundException extends RuntimeException {
    private final Long userId;

    public UserNotFoundException(Long userId) {
        super("User " + userId + " not found");
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }
}
