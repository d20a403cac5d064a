package boxless.email.app.service;

import boxless.email.app.entity.OAuthToken;
import boxless.email.app.entity.User;
import boxless.email.app.provider.MailProviderClientFactory;
import boxless.email.app.provider.MailProviderException;
import boxless.email.app.provider.ProviderCredentials;
import boxless.email.app.provider.ProviderProfile;
import boxless.email.app.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.util.Optional;

@Slf4j
@Service
public class UserAccountService {
    private final UserRepository userRepository;
    private final SyncStatusService syncStatusService;
    private final MailProviderClientFactory clientFactory;

    public UserAccountService(
            UserRepository userRepository,
            SyncStatusService syncStatusService,
            MailProviderClientFactory clientFactory) {
        this.userRepository = userRepository;
        this.syncStatusService = syncStatusService;
        this.clientFactory = clientFactory;
    }

    /**
     * Looks up the mailbox owner of the given credentials and stores them on the matching user,
     * creating the user (with a pending sync status) on first sight.
     */
    @Transactional
    public User registerAccount(ProviderCredentials credentials) {
        ProviderProfile profile;
        try {
            profile = clientFactory.create(credentials).getProfile();
        } catch (IOException e) {
            throw new MailProviderException("Could not read mailbox profile: " + e.getMessage(), e);
        }

        String email = profile.getEmailAddress();
        Optional<User> existingUser = userRepository.findByEmail(email);
        User user;
        if (existingUser.isPresent()) {
            user = existingUser.get();
        } else {
            user = new User();
            user.setEmail(email);
            log.info("Creating user for {}", email);
        }

        OAuthToken token = new OAuthToken();
        token.setAccessToken(credentials.getAccessToken());
        // Google only returns a refresh token on first consent; keep the stored one otherwise.
        if (credentials.getRefreshToken() != null) {
            token.setRefreshToken(credentials.getRefreshToken());
        } else if (user.getToken() != null) {
            token.setRefreshToken(user.getToken().getRefreshToken());
        }
        token.setExpiry(credentials.getExpiry());
        user.setToken(token);
        user.setActive(true);

        User saved = userRepository.save(user);
        syncStatusService.create(saved.getId());
        return saved;
    }
}
