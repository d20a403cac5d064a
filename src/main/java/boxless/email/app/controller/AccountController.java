package boxless.email.app.controller;

import boxless.email.app.entity.User;
import boxless.email.app.provider.MailProviderException;
import boxless.email.app.provider.ProviderCredentials;
import boxless.email.app.service.UserAccountService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Stores the tokens obtained by the OAuth flow and links them to a user.
 */
@Slf4j
@RestController
public class AccountController {
    private final UserAccountService userAccountService;

    public AccountController(UserAccountService userAccountService) {
        this.userAccountService = userAccountService;
    }

    @PostMapping("/accounts")
    public ResponseEntity<?> registerAccount(@RequestBody(required = false) RegisterAccountRequest request) {
        if (request == null || request.getAccessToken() == null || request.getAccessToken().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "access_token is required"));
        }

        ProviderCredentials credentials = new ProviderCredentials(
            request.getAccessToken(), request.getRefreshToken(), request.getExpiresAt());
        try {
            User user = userAccountService.registerAccount(credentials);
            return ResponseEntity.ok(Map.of(
                "user_id", user.getId(),
                "email", user.getEmail(),
                "active", user.isActive()
            ));
        } catch (MailProviderException e) {
            log.warn("Account registration failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
        }
    }
}
