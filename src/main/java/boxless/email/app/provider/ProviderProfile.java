package boxless.email.app.provider;

import lombok.Value;

@Value
public class ProviderProfile {
    String emailAddress;
}
