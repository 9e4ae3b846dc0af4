package io.dispatch4j.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ImageGenerationPayload(
        @NotBlank String brandId,
        @NotBlank @Size(max = 1000) String prompt,
        Style style,
        AspectRatio aspectRatio,
        String contentItemId
) implements JobPayload {

    public enum Style {
        @JsonProperty("realistic") REALISTIC,
        @JsonProperty("artistic") ARTISTIC,
        @JsonProperty("minimal") MINIMAL,
        @JsonProperty("branded") BRANDED
    }

    public enum AspectRatio {
        @JsonProperty("1:1") SQUARE,
        @JsonProperty("16:9") LANDSCAPE,
        @JsonProperty("9:16") PORTRAIT,
        @JsonProperty("4:3") STANDARD
    }
}
