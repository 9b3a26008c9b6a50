package io.marketstream.gateway.auth;

import io.marketstream.normalizer.model.Exchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Function;

/**
 * Reads credentials from environment variables:
 * {@code BITGET_API_KEY}, {@code BITGET_SECRET_KEY}, {@code BITGET_PASSPHRASE},
 * {@code KUCOIN_API_KEY}, {@code KUCOIN_SECRET_KEY}, {@code KUCOIN_PASSPHRASE}.
 * A partial set counts as absent.
 */
public class EnvCredentialsProvider implements CredentialsProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnvCredentialsProvider.class);

    private final Function<String, String> environment;

    public EnvCredentialsProvider() {
        this(System::getenv);
    }

    public EnvCredentialsProvider(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public Optional<Credentials> getCredentials(Exchange exchange) {
        String prefix = exchange.name();
        String apiKey = read(prefix + "_API_KEY");
        String secretKey = read(prefix + "_SECRET_KEY");
        String passphrase = read(prefix + "_PASSPHRASE");

        if (apiKey == null && secretKey == null && passphrase == null) {
            return Optional.empty();
        }
        if (apiKey == null || secretKey == null || passphrase == null) {
            LOGGER.warn("Incomplete {} credentials in environment, using public channels only", exchange);
            return Optional.empty();
        }
        return Optional.of(new Credentials(apiKey, secretKey, passphrase));
    }

    private String read(String key) {
        String value = environment.apply(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
