package dev.aparikh.mailindex.api;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Response DTO for the message count API.
 */
@Schema(description = "Message count response")
public record CountResponse(
        @Schema(description = "Total number of indexed messages", example = "42")
        long count
) {
}
