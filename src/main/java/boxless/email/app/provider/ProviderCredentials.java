package boxless.email.app.provider;

import lombok.Value;

import java.time.Instant;

/**
 * OAuth token triple handed to a provider client. Built from stored user fields.
 */
@Value
public class ProviderCredentials {
    String accessToken;
    String refreshToken;
    Instant expiry;

    @Override
    public String toString() {
        return "ProviderCredentials(expiry=" + expiry + ")";
    }
}
