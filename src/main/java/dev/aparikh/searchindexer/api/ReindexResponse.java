package dev.aparikh.searchindexer.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Response DTO for a completed reindex.
 */
@Schema(description = "Reindex result")
public record ReindexResponse(
        @Schema(description = "Indexer type tag", example = "article")
        String type,

        @Schema(description = "Number of records transformed and written", example = "2500")
        long indexed,

        @Schema(description = "Watermark of the pass; older documents of this type were deleted",
                example = "2025-01-01T10:00:00Z")
        Instant startedAt,

        @Schema(description = "When the pass completed", example = "2025-01-01T10:02:13Z")
        Instant finishedAt
) {
}
