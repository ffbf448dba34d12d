package dev.aparikh.searchindexer.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Standard error response for API endpoints.
 */
@Schema(description = "Error response")
public record ErrorResponse(
        @Schema(description = "Error message", example = "No indexer registered for type 'article'")
        String message,

        @Schema(description = "Error code", example = "INDEXER_NOT_FOUND")
        String code,

        @Schema(description = "Offending items, e.g. the fields missing from the index schema",
                example = "[\"summary_txt\"]")
        List<String> details,

        @Schema(description = "Timestamp of the error", example = "2025-01-01T10:00:00Z")
        Instant timestamp
) {
    public ErrorResponse(String message, String code) {
        this(message, code, List.of(), Instant.now());
    }
}
