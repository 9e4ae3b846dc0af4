package io.dispatch4j.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.constraints.URL;

public record DocumentProcessingPayload(
        @NotBlank String contextSourceId,
        @NotBlank String brandId,
        @NotBlank @URL String fileUrl,
        @NotBlank String fileName,
        @NotNull MimeType mimeType
) implements JobPayload {

    public enum MimeType {
        @JsonProperty("application/pdf") PDF,
        @JsonProperty("text/plain") PLAIN_TEXT,
        @JsonProperty("text/markdown") MARKDOWN
    }
}
