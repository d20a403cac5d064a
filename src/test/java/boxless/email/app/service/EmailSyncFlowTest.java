package boxless.email.app.service;

import boxless.email.app.entity.OAuthToken;
import boxless.email.app.entity.User;
import boxless.email.app.provider.MailProviderClient;
import boxless.email.app.provider.MailProviderClientFactory;
import boxless.email.app.provider.MessagePage;
import boxless.email.app.provider.ProviderLabel;
import boxless.email.app.provider.ProviderMessage;
import boxless.email.app.repository.EmailRepository;
import boxless.email.app.repository.LabelRepository;
import boxless.email.app.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Full run against the JPA store with a scripted provider.
 */
@DataJpaTest(properties = "sync.page-delay=0s")
@Import({EmailSyncService.class, SyncStatusService.class, EmailReconciliationService.class, TokenRefreshService.class})
class EmailSyncFlowTest {

    @TestConfiguration
    static class ClockConfig {
        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }
    }

    @MockBean
    private MailProviderClientFactory clientFactory;

    @Autowired
    private EmailSyncService emailSyncService;

    @Autowired
    private SyncStatusService syncStatusService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private EmailRepository emailRepository;

    @Autowired
    private LabelRepository labelRepository;

    private final MailProviderClient client = mock(MailProviderClient.class);
    private User testUser;

    @BeforeEach
    void setUp() throws Exception {
        OAuthToken token = new OAuthToken();
        token.setAccessToken("access_token");
        token.setRefreshToken("refresh_token");
        User user = new User();
        user.setEmail("u@example.com");
        user.setToken(token);
        testUser = userRepository.save(user);

        when(clientFactory.create(any())).thenReturn(client);
        when(client.listLabels()).thenReturn(List.of(
                ProviderLabel.builder().id("INBOX").name("INBOX").type("system").build(),
                ProviderLabel.builder().id("Label_7").name("Travel").build()));
        when(client.listMessages(eq("newer_than:30d"), eq(100), isNull(), isNull()))
                .thenReturn(new MessagePage(messages(0, 100), "next"));
        when(client.listMessages(eq("newer_than:30d"), eq(100), isNull(), eq("next")))
                .thenReturn(new MessagePage(messages(100, 50), null));
    }

    private static List<ProviderMessage> messages(int from, int count) {
        List<ProviderMessage> messages = new ArrayList<>();
        for (int i = from; i < from + count; i++) {
            messages.add(ProviderMessage.builder()
                    .id("msg-" + i)
                    .threadId("thread-" + i)
                    .subject("Subject " + i)
                    .sender("sender@example.com")
                    .build());
        }
        return messages;
    }

    @Test
    void runUserSync_ShouldStoreAllLabelsAndEmails() {
        // When
        SyncResult result = emailSyncService.runUserSync(testUser.getId());

        // Then
        assertEquals(SyncResult.COMPLETED, result.getStatus());
        assertEquals(150, result.getEmailsSynced());
        assertEquals(2, result.getLabelsSynced());
        assertEquals(150, emailRepository.countByUserId(testUser.getId()));
        assertEquals(2, labelRepository.countByUserId(testUser.getId()));

        SyncStatusView status = syncStatusService.read(testUser.getId());
        assertEquals("completed", status.getStatus());
        assertEquals(150, status.getEmailsSynced());
        assertNull(status.getErrorMessage());
    }

    @Test
    void runUserSync_Twice_ShouldReportOnlyNewRows() {
        // Given
        emailSyncService.runUserSync(testUser.getId());

        // When
        SyncResult second = emailSyncService.runUserSync(testUser.getId());

        // Then
        assertEquals(SyncResult.COMPLETED, second.getStatus());
        assertEquals(0, second.getEmailsSynced());
        assertEquals(0, second.getLabelsSynced());
        assertEquals(150, emailRepository.countByUserId(testUser.getId()));
        assertEquals(0, syncStatusService.read(testUser.getId()).getEmailsSynced());
    }
}
