package boxless.email.app.provider;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProviderLabel {
    String id;
    String name;
    @Builder.Default
    String type = "user";
    int messagesTotal;
    int messagesUnread;
}
