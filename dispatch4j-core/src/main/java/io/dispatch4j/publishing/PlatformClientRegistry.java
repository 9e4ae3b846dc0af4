package io.dispatch4j.publishing;

import io.dispatch4j.core.Platform;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Dispatch table from {@link Platform} to the factory building its client.
 * Platforms without a factory are reported as unsupported.
 */
public final class PlatformClientRegistry {

    private final Map<Platform, PlatformClientFactory> factories;

    public PlatformClientRegistry(List<PlatformClientFactory> factories) {
        Objects.requireNonNull(factories, "factories must not be null");
        Map<Platform, PlatformClientFactory> map = new EnumMap<>(Platform.class);
        for (PlatformClientFactory f : factories) {
            PlatformClientFactory prev = map.putIfAbsent(f.platform(), f);
            if (prev != null) {
                throw new IllegalStateException("Duplicate PlatformClientFactory for platform: " + f.platform());
            }
        }
        this.factories = Collections.unmodifiableMap(map);
    }

    public Optional<PlatformPublishClient> clientFor(PublishCredentials credentials) {
        PlatformClientFactory factory = factories.get(credentials.platform());
        return factory == null ? Optional.empty() : Optional.of(factory.create(credentials));
    }

    public Set<Platform> supportedPlatforms() {
        return factories.keySet();
    }
}
