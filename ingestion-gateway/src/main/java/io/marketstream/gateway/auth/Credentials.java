package io.marketstream.gateway.auth;

/**
 * API credentials for one exchange account.
 *
 * @param apiKey     API key
 * @param secretKey  API secret used for request signing
 * @param passphrase API passphrase
 */
public record Credentials(
    String apiKey,
    String secretKey,
    String passphrase
) {
    public Credentials {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey cannot be null or blank");
        }
        if (secretKey == null || secretKey.isBlank()) {
            throw new IllegalArgumentException("secretKey cannot be null or blank");
        }
        if (passphrase == null || passphrase.isBlank()) {
            throw new IllegalArgumentException("passphrase cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return "Credentials[apiKey=" + mask(apiKey) + "]";
    }

    private static String mask(String value) {
        return value.length() <= 4 ? "****" : value.substring(0, 4) + "****";
    }
}
