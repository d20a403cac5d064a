package boxless.email.app.controller;

import lombok.Data;

import java.time.Instant;

@Data
public class RegisterAccountRequest {
    private String accessToken;
    private String refreshToken;
    private Instant expiresAt;
}
