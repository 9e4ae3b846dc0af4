package io.dispatch4j.publishing;

import io.dispatch4j.core.Platform;

import java.time.Instant;

/**
 * Tokens of one connected social account. Opaque to the dispatcher; only platform
 * clients read them.
 */
public record PublishCredentials(
        String accountId,
        Platform platform,
        String accessToken,
        String refreshToken,
        Instant expiresAt
) {

    @Override
    public String toString() {
        return "PublishCredentials[accountId=" + accountId + ", platform=" + platform + ", expiresAt=" + expiresAt + "]";
    }
}
