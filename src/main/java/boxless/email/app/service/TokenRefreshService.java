package boxless.email.app.service;

import boxless.email.app.entity.OAuthToken;
import boxless.email.app.entity.User;
import boxless.email.app.provider.ProviderCredentials;
import boxless.email.app.repository.UserRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

@Slf4j
@Service
public class TokenRefreshService {
    static final String TOKEN_ENDPOINT = "https://oauth2.googleapis.com/token";
    private static final long EXPIRY_SKEW_SECONDS = 300;

    private final UserRepository userRepository;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${google.oauth.client-id:}")
    private String clientId;

    @Value("${google.oauth.client-secret:}")
    private String clientSecret;

    public TokenRefreshService(UserRepository userRepository) {
        this.userRepository = userRepository;
        this.restTemplate = new RestTemplate();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Builds provider credentials from the stored token triple. The access token is exchanged
     * first when its expiry is known and falls within the next five minutes; a token without
     * an expiry is used as stored.
     */
    public ProviderCredentials ensureFreshCredentials(User user) {
        if (!user.hasAccessToken()) {
            throw new SyncPreconditionException("User " + user.getId() + " has no access token");
        }

        OAuthToken token = user.getToken();
        boolean needsRefresh = token.getExpiry() != null
                && token.getExpiry().isBefore(Instant.now().plusSeconds(EXPIRY_SKEW_SECONDS));

        if (needsRefresh) {
            if (token.getRefreshToken() == null || token.getRefreshToken().isEmpty()) {
                throw new SyncPreconditionException("Access token expired and no refresh token available for user "
                        + user.getId() + ". Please re-authenticate.");
            }
            log.info("Refreshing access token for user {}", user.getId());
            refreshAccessToken(user);
        }

        return new ProviderCredentials(token.getAccessToken(), token.getRefreshToken(), token.getExpiry());
    }

    /**
     * Exchanges the refresh token for a new access token and stores it on the user.
     */
    public void refreshAccessToken(User user) {
        validateClientCredentials();
        OAuthToken token = user.getToken();

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

            MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
            body.add("client_id", clientId);
            body.add("client_secret", clientSecret);
            body.add("refresh_token", token.getRefreshToken());
            body.add("grant_type", "refresh_token");

            ResponseEntity<String> response = restTemplate.postForEntity(
                TOKEN_ENDPOINT,
                new HttpEntity<>(body, headers),
                String.class
            );

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new IllegalStateException("Token endpoint returned " + response.getStatusCode());
            }

            JsonNode jsonResponse = objectMapper.readTree(response.getBody());
            if (!jsonResponse.has("access_token")) {
                throw new IllegalStateException("Token refresh response missing access_token");
            }

            long expiresInSeconds = jsonResponse.has("expires_in")
                ? jsonResponse.get("expires_in").asLong()
                : 3600;
            token.setAccessToken(jsonResponse.get("access_token").asText());
            token.setExpiry(Instant.now().plusSeconds(expiresInSeconds));
            // Google rarely rotates the refresh token, keep the old one unless a new one is sent.
            if (jsonResponse.has("refresh_token") && !jsonResponse.get("refresh_token").isNull()) {
                token.setRefreshToken(jsonResponse.get("refresh_token").asText());
            }

            user.setToken(token);
            userRepository.save(user);
            log.info("Token refreshed for user {}, expires at {}", user.getId(), token.getExpiry());
        } catch (Exception e) {
            log.error("Failed to refresh access token for user {}: {}", user.getId(), e.getMessage(), e);
            throw new IllegalStateException("Failed to refresh access token for user " + user.getId() + ": " + e.getMessage(), e);
        }
    }

    private void validateClientCredentials() {
        if (clientId == null || clientId.isEmpty()) {
            throw new IllegalStateException("Google OAuth client-id is not configured. Please set google.oauth.client-id");
        }
        if (clientSecret == null || clientSecret.isEmpty()) {
            throw new IllegalStateException("Google OAuth client-secret is not configured. Please set google.oauth.client-secret");
        }
    }
}
