package io.marketstream.gateway.auth;

import io.marketstream.normalizer.model.Exchange;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EnvCredentialsProvider.
 */
class EnvCredentialsProviderTest {

    @Test
    void testCompleteCredentials() {
        Map<String, String> env = Map.of(
            "KUCOIN_API_KEY", "key-1",
            "KUCOIN_SECRET_KEY", " secret-1 ",
            "KUCOIN_PASSPHRASE", "pass-1"
        );
        EnvCredentialsProvider provider = new EnvCredentialsProvider(env::get);

        Optional<Credentials> credentials = provider.getCredentials(Exchange.KUCOIN);

        assertTrue(credentials.isPresent());
        assertEquals("key-1", credentials.get().apiKey());
        assertEquals("secret-1", credentials.get().secretKey());
        assertTrue(provider.getCredentials(Exchange.BITGET).isEmpty());
    }

    @Test
    void testPartialCredentialsTreatedAsAbsent() {
        Map<String, String> env = Map.of(
            "BITGET_API_KEY", "key-1",
            "BITGET_PASSPHRASE", ""
        );
        EnvCredentialsProvider provider = new EnvCredentialsProvider(env::get);

        assertTrue(provider.getCredentials(Exchange.BITGET).isEmpty());
    }

    @Test
    void testCredentialsToStringMasksSecrets() {
        Credentials credentials = new Credentials("abcdefgh", "secret-value", "passphrase-value");

        String text = credentials.toString();

        assertTrue(text.contains("abcd****"));
        assertFalse(text.contains("secret-value"));
        assertFalse(text.contains("passphrase-value"));
        assertThrows(IllegalArgumentException.class, () -> new Credentials("key", " ", "pass"));
    }
}
