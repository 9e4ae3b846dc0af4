package io.dispatch4j.publishing;

import java.util.List;

public record PublishRequest(String content, List<String> mediaUrls) {
    public PublishRequest {
        mediaUrls = mediaUrls == null ? List.of() : List.copyOf(mediaUrls);
    }
}
