package boxless.email.app.provider;

import java.io.IOException;
import java.util.List;

/**
 * Read access to one user's mailbox at the mail provider.
 * Instances are bound to a single set of credentials and are not shared between sync runs.
 */
public interface MailProviderClient {
    /**
     * List all labels of the mailbox.
     * @return labels in provider order
     * @throws IOException if the API call fails
     */
    List<ProviderLabel> listLabels() throws IOException;

    /**
     * List one page of messages, fully fetched and normalized.
     * @param query provider search query, or null for none
     * @param maxResults upper bound on messages in the page
     * @param labelIds restrict to these labels, or null for all
     * @param pageToken token from the previous page, or null for the first page
     * @return the page, with the token for the next page if there is one
     * @throws IOException if the API call fails
     */
    MessagePage listMessages(String query, int maxResults, List<String> labelIds, String pageToken) throws IOException;

    /**
     * Fetch the mailbox profile.
     * @return address and current history id
     * @throws IOException if the API call fails
     */
    ProviderProfile getProfile() throws IOException;
}
