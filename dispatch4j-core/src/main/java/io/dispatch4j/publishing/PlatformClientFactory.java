package io.dispatch4j.publishing;

import io.dispatch4j.core.Platform;

public interface PlatformClientFactory {
    Platform platform();

    PlatformPublishClient create(PublishCredentials credentials);
}
