package boxless.email.app.service;

import boxless.email.app.config.SyncProperties;
import boxless.email.app.entity.OAuthToken;
import boxless.email.app.entity.SyncState;
import boxless.email.app.entity.User;
import boxless.email.app.provider.MailProviderClient;
import boxless.email.app.provider.MailProviderClientFactory;
import boxless.email.app.provider.MessagePage;
import boxless.email.app.provider.ProviderCredentials;
import boxless.email.app.provider.ProviderLabel;
import boxless.email.app.provider.ProviderMessage;
import boxless.email.app.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailSyncServiceTest {
    private static final String QUERY = "newer_than:30d";

    @Mock
    private UserRepository userRepository;

    @Mock
    private SyncStatusService syncStatusService;

    @Mock
    private EmailReconciliationService reconciliationService;

    @Mock
    private TokenRefreshService tokenRefreshService;

    @Mock
    private MailProviderClientFactory clientFactory;

    @Mock
    private MailProviderClient client;

    private SyncProperties properties;
    private EmailSyncService emailSyncService;
    private User testUser;
    private ProviderCredentials credentials;
    private List<ProviderLabel> labels;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        properties.setPageDelay(Duration.ZERO);

        emailSyncService = new EmailSyncService(userRepository, syncStatusService, reconciliationService,
                tokenRefreshService, clientFactory, properties);

        OAuthToken token = new OAuthToken();
        token.setAccessToken("access_token");
        token.setRefreshToken("refresh_token");

        testUser = new User();
        testUser.setId(1L);
        testUser.setEmail("test@example.com");
        testUser.setToken(token);

        credentials = new ProviderCredentials("access_token", "refresh_token", null);
        labels = List.of(
                ProviderLabel.builder().id("INBOX").name("INBOX").type("system").build(),
                ProviderLabel.builder().id("Label_1").name("Receipts").build());
    }

    private void givenReadyProvider() throws IOException {
        when(userRepository.findById(1L)).thenReturn(Optional.of(testUser));
        when(tokenRefreshService.ensureFreshCredentials(testUser)).thenReturn(credentials);
        when(clientFactory.create(credentials)).thenReturn(client);
        when(client.listLabels()).thenReturn(labels);
        when(reconciliationService.reconcileLabels(1L, labels)).thenReturn(new LabelReconcileResult(2, 2));
    }

    private static List<ProviderMessage> messages(int from, int count) {
        List<ProviderMessage> messages = new ArrayList<>();
        for (int i = from; i < from + count; i++) {
            messages.add(ProviderMessage.builder().id("msg-" + i).threadId("thread-" + i).build());
        }
        return messages;
    }

    @Test
    void runUserSync_WithTwoPages_ShouldCompleteWithAllCreatedEmails() throws Exception {
        // Given
        givenReadyProvider();
        List<ProviderMessage> page1 = messages(0, 100);
        List<ProviderMessage> page2 = messages(100, 50);
        when(client.listMessages(QUERY, 100, null, null)).thenReturn(new MessagePage(page1, "page-2"));
        when(client.listMessages(QUERY, 100, null, "page-2")).thenReturn(new MessagePage(page2, null));
        when(reconciliationService.reconcileEmails(1L, page1)).thenReturn(new EmailReconcileResult(100, 0, 100));
        when(reconciliationService.reconcileEmails(1L, page2)).thenReturn(new EmailReconcileResult(50, 0, 50));

        // When
        SyncResult result = emailSyncService.runUserSync(1L);

        // Then
        assertEquals(SyncResult.COMPLETED, result.getStatus());
        assertEquals(150, result.getEmailsSynced());
        assertEquals(2, result.getLabelsSynced());
        assertNull(result.getError());

        InOrder inOrder = inOrder(syncStatusService);
        inOrder.verify(syncStatusService).update(1L, SyncState.RUNNING, null, "");
        inOrder.verify(syncStatusService).update(1L, SyncState.COMPLETED, 150, null);
        verify(syncStatusService, never()).update(anyLong(), eq(SyncState.FAILED), any(), any());
    }

    @Test
    void runUserSync_WhenSecondPageFails_ShouldKeepFirstPageAndStillComplete() throws Exception {
        // Given
        givenReadyProvider();
        List<ProviderMessage> page1 = messages(0, 100);
        when(client.listMessages(QUERY, 100, null, null)).thenReturn(new MessagePage(page1, "page-2"));
        when(client.listMessages(QUERY, 100, null, "page-2")).thenThrow(new IOException("Rate limit exceeded"));
        when(reconciliationService.reconcileEmails(1L, page1)).thenReturn(new EmailReconcileResult(100, 0, 100));

        // When
        SyncResult result = emailSyncService.runUserSync(1L);

        // Then
        assertEquals(SyncResult.COMPLETED, result.getStatus());
        assertEquals(100, result.getEmailsSynced());
        verify(client, never()).listMessages(anyString(), anyInt(), any(), eq("page-3"));
        verify(syncStatusService).update(1L, SyncState.COMPLETED, 100, null);
    }

    @Test
    void runUserSync_WhenReconcileFails_ShouldStopPagingWithPartialCount() throws Exception {
        // Given
        givenReadyProvider();
        List<ProviderMessage> page1 = messages(0, 100);
        List<ProviderMessage> page2 = messages(100, 100);
        when(client.listMessages(QUERY, 100, null, null)).thenReturn(new MessagePage(page1, "page-2"));
        when(client.listMessages(QUERY, 100, null, "page-2")).thenReturn(new MessagePage(page2, "page-3"));
        when(reconciliationService.reconcileEmails(1L, page1)).thenReturn(new EmailReconcileResult(40, 60, 100));
        when(reconciliationService.reconcileEmails(1L, page2)).thenThrow(new IllegalStateException("connection reset"));

        // When
        SyncResult result = emailSyncService.runUserSync(1L);

        // Then
        assertEquals(SyncResult.COMPLETED, result.getStatus());
        assertEquals(40, result.getEmailsSynced());
        verify(client, never()).listMessages(anyString(), anyInt(), any(), eq("page-3"));
    }

    @Test
    void runUserSync_ShouldStopAtMessageCap() throws Exception {
        // Given
        properties.setMaxMessages(150);
        givenReadyProvider();
        List<ProviderMessage> page1 = messages(0, 100);
        List<ProviderMessage> page2 = messages(100, 50);
        when(client.listMessages(QUERY, 100, null, null)).thenReturn(new MessagePage(page1, "page-2"));
        when(client.listMessages(QUERY, 50, null, "page-2")).thenReturn(new MessagePage(page2, "page-3"));
        when(reconciliationService.reconcileEmails(1L, page1)).thenReturn(new EmailReconcileResult(100, 0, 100));
        when(reconciliationService.reconcileEmails(1L, page2)).thenReturn(new EmailReconcileResult(50, 0, 50));

        // When
        SyncResult result = emailSyncService.runUserSync(1L);

        // Then
        assertEquals(150, result.getEmailsSynced());
        verify(client, times(2)).listMessages(anyString(), anyInt(), any(), any());
    }

    @Test
    void runUserSync_WithEmptyMailbox_ShouldCompleteWithZero() throws Exception {
        // Given
        givenReadyProvider();
        when(client.listMessages(QUERY, 100, null, null)).thenReturn(new MessagePage(List.of(), null));

        // When
        SyncResult result = emailSyncService.runUserSync(1L);

        // Then
        assertEquals(SyncResult.COMPLETED, result.getStatus());
        assertEquals(0, result.getEmailsSynced());
        verify(reconciliationService, never()).reconcileEmails(anyLong(), anyList());
    }

    @Test
    void runUserSync_WithoutAccessToken_ShouldFailAfterRunning() {
        // Given
        testUser.setToken(null);
        when(userRepository.findById(1L)).thenReturn(Optional.of(testUser));

        // When
        SyncResult result = emailSyncService.runUserSync(1L);

        // Then
        assertTrue(result.isFailed());
        assertEquals("User 1 has no access token", result.getError());
        assertNull(result.getEmailsSynced());

        InOrder inOrder = inOrder(syncStatusService);
        inOrder.verify(syncStatusService).update(1L, SyncState.RUNNING, null, "");
        inOrder.verify(syncStatusService).update(1L, SyncState.FAILED, null, "User 1 has no access token");
        verify(clientFactory, never()).create(any());
    }

    @Test
    void runUserSync_WhenLabelFetchFails_ShouldMarkFailed() throws Exception {
        // Given
        when(userRepository.findById(1L)).thenReturn(Optional.of(testUser));
        when(tokenRefreshService.ensureFreshCredentials(testUser)).thenReturn(credentials);
        when(clientFactory.create(credentials)).thenReturn(client);
        when(client.listLabels()).thenThrow(new IOException("401 Unauthorized"));

        // When
        SyncResult result = emailSyncService.runUserSync(1L);

        // Then
        assertTrue(result.isFailed());
        assertEquals("401 Unauthorized", result.getError());
        verify(syncStatusService).update(1L, SyncState.FAILED, null, "401 Unauthorized");
        verify(syncStatusService, never()).update(anyLong(), eq(SyncState.COMPLETED), any(), any());
    }

    @Test
    void runUserSync_ForUnknownUser_ShouldReturnFailureWithoutThrowing() {
        // Given
        when(syncStatusService.update(eq(9L), any(SyncState.class), any(), any()))
                .thenThrow(new UserNotFoundException(9L));

        // When
        SyncResult result = assertDoesNotThrow(() -> emailSyncService.runUserSync(9L));

        // Then
        assertTrue(result.isFailed());
        assertEquals("User 9 not found", result.getError());
        verify(syncStatusService).update(9L, SyncState.FAILED, null, "User 9 not found");
        verify(clientFactory, never()).create(any());
    }
}
