package io.marketstream.gateway.auth;

import io.marketstream.normalizer.model.Exchange;

import java.util.Optional;

/**
 * Source of API credentials. Empty means public channels only.
 */
@FunctionalInterface
public interface CredentialsProvider {

    Optional<Credentials> getCredentials(Exchange exchange);

    static CredentialsProvider none() {
        return exchange -> Optional.empty();
    }
}
