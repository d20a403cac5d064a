package boxless.email.app.provider;

import lombok.Value;

import java.util.List;

/**
 * One page of a message listing. {@code nextPageToken} is null on the last page.
 */
@Value
public class MessagePage {
    List<ProviderMessage> messages;
    String nextPageToken;

    public boolean isEmpty() {
        return messages == null || messages.isEmpty();
    }

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isEmpty();
    }
}
