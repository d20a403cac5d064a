package boxless.email.app.provider;

public interface MailProviderClientFactory {
    MailProviderClient create(ProviderCredentials credentials);
}
