package boxless.email.app.provider;

import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.ListLabelsResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.Profile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link MailProviderClient} backed by the Gmail REST API for the authenticated user ("me").
 */
@Slf4j
public class GmailProviderClient implements MailProviderClient {
    private static final String ME = "me";

    private final Gmail gmail;
    private final GmailMessageParser parser;

    public GmailProviderClient(Gmail gmail, GmailMessageParser parser) {
        this.gmail = gmail;
        this.parser = parser;
    }

    @Override
    public List<ProviderLabel> listLabels() throws IOException {
        ListLabelsResponse response = gmail.users().labels().list(ME).execute();
        if (response.getLabels() == null) {
            return Collections.emptyList();
        }
        List<ProviderLabel> labels = new ArrayList<>();
        for (com.google.api.services.gmail.model.Label label : response.getLabels()) {
            labels.add(ProviderLabel.builder()
                    .id(label.getId())
                    .name(label.getName())
                    .type(label.getType() != null ? label.getType().toLowerCase() : "user")
                    .messagesTotal(label.getMessagesTotal() != null ? label.getMessagesTotal() : 0)
                    .messagesUnread(label.getMessagesUnread() != null ? label.getMessagesUnread() : 0)
                    .build());
        }
        return labels;
    }

    @Override
    public MessagePage listMessages(String query, int maxResults, List<String> labelIds, String pageToken) throws IOException {
        Gmail.Users.Messages.List request = gmail.users().messages().list(ME)
                .setMaxResults((long) maxResults);
        if (query != null && !query.isEmpty()) {
            request.setQ(query);
        }
        if (labelIds != null && !labelIds.isEmpty()) {
            request.setLabelIds(labelIds);
        }
        if (pageToken != null) {
            request.setPageToken(pageToken);
        }

        ListMessagesResponse response = request.execute();
        List<ProviderMessage> messages = new ArrayList<>();
        if (response.getMessages() != null) {
            for (Message messageRef : response.getMessages()) {
                Message message = gmail.users().messages().get(ME, messageRef.getId())
                        .setFormat("full")
                        .execute();
                messages.add(parser.parse(message));
            }
        }
        log.debug("Fetched {} messages (next page: {})", messages.size(), response.getNextPageToken() != null);
        return new MessagePage(messages, response.getNextPageToken());
    }

    @Override
    public ProviderProfile getProfile() throws IOException {
        Profile profile = gmail.users().getProfile(ME).execute();
        return new ProviderProfile(profile.getEmailAddress());
    }
}
