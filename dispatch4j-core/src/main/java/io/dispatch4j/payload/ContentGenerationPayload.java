package io.dispatch4j.payload;

import io.dispatch4j.core.Platform;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ContentGenerationPayload(
        @NotBlank String brandId,
        @NotBlank @Size(max = 500) String topic,
        @NotEmpty List<Platform> platforms,
        String tone,
        ContentType contentType,
        List<String> contextItemIds
) implements JobPayload {

    public enum ContentType {
        POST, THREAD, ARTICLE
    }
}
