package boxless.email.app.provider;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A provider message normalized into the fields the store keeps.
 */
@Value
@Builder
public class ProviderMessage {
    String id;
    String threadId;
    String subject;
    String sender;
    String recipient;
    String cc;
    String bcc;
    Instant dateSent;
    Instant dateReceived;
    String bodyText;
    String bodyHtml;
    String snippet;
    boolean read;
    boolean starred;
    boolean important;
    @Singular
    Map<String, String> headers;
    @Singular
    List<String> labelIds;
    int attachmentCount;
}
