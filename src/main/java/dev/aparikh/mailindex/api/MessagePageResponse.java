package dev.aparikh.mailindex.api;

import dev.aparikh.mailindex.model.Message;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * One page of the date-ordered message listing.
 */
@Schema(description = "Date-ordered message page")
public record MessagePageResponse(
        @Schema(description = "Messages on this page, ascending by date key")
        List<Message> messages,

        @Schema(description = "Total number of messages", example = "42")
        long totalCount,

        @Schema(description = "Current page number (0-based)", example = "0")
        int page,

        @Schema(description = "Number of results per page", example = "100")
        int size,

        @Schema(description = "Total number of pages", example = "1")
        int totalPages
) {}
