package dev.aparikh.mailindex.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for creating a message.
 */
@Schema(description = "New message to index")
public record IngestRequest(
        @NotNull
        @Schema(description = "Sender identity, matched exactly by sender lookups",
                example = "a@x.com",
                requiredMode = Schema.RequiredMode.REQUIRED)
        String sender,

        @Schema(description = "Subject line, may be empty", example = "Hi")
        String subject,

        @Schema(description = "Message body, may be empty", example = "Hi there")
        String body,

        @NotNull
        @Schema(description = "Sortable date key, compared as text (ISO-8601 recommended)",
                example = "2025-01-02",
                requiredMode = Schema.RequiredMode.REQUIRED)
        String dateKey
) {
}
