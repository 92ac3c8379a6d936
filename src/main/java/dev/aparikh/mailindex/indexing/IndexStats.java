package dev.aparikh.mailindex.indexing;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Snapshot of index sizes.
 */
@Schema(description = "Index statistics")
public record IndexStats(
        @Schema(description = "Number of stored messages", example = "42")
        int messages,

        @Schema(description = "Number of distinct senders", example = "7")
        int senders,

        @Schema(description = "Number of distinct indexed terms", example = "310")
        int terms,

        @Schema(description = "Height of the date-ordered tree", example = "12")
        int dateTreeHeight
) {
}
