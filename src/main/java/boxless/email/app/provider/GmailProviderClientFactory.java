package boxless.email.app.provider;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.security.GeneralSecurityException;

/**
 * Builds a Gmail client per set of credentials. The HTTP transport is shared, the
 * {@link Credential} never is.
 */
@Component
public class GmailProviderClientFactory implements MailProviderClientFactory {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "Boxless Mail Sync";

    private final NetHttpTransport httpTransport;
    private final GmailMessageParser parser = new GmailMessageParser();

    public GmailProviderClientFactory() throws GeneralSecurityException, IOException {
        this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
    }

    @Override
    public MailProviderClient create(ProviderCredentials credentials) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
                .setTransport(httpTransport)
                .setJsonFactory(JSON_FACTORY)
                .build();
        // Refresh happens before the run in TokenRefreshService, so only the access token is set.
        credential.setAccessToken(credentials.getAccessToken());

        Gmail gmail = new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
                .setApplicationName(APPLICATION_NAME)
                .build();
        return new GmailProviderClient(gmail, parser);
    }
}
