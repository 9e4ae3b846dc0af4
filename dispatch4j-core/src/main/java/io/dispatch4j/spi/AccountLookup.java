package io.dispatch4j.spi;

import io.dispatch4j.publishing.PublishCredentials;

import java.util.Optional;

@FunctionalInterface
public interface AccountLookup {
    Optional<PublishCredentials> credentialsFor(String accountId);
}
