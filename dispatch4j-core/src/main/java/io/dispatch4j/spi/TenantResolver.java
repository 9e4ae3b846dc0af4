package io.dispatch4j.spi;

import java.util.Optional;

/**
 * Resolves the tenant owning a parent entity such as a brand.
 */
@FunctionalInterface
public interface TenantResolver {
    Optional<String> ownerOf(String parentId);
}
