package io.dispatch4j.publishing;

/**
 * Publishes to one platform with one account's credentials.
 *
 * <p>Implementations report platform-side rejections as a failed {@link PublishResult};
 * exceptions thrown here are treated the same way by the caller.
 */
public interface PlatformPublishClient {
    PublishResult publish(PublishRequest request) throws Exception;
}
