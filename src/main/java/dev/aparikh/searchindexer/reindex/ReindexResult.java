package dev.aparikh.searchindexer.reindex;

import java.time.Instant;

/**
 * Outcome of one completed reindex pass.
 */
public record ReindexResult(
        String type,
        long indexed,
        Instant startedAt,
        Instant finishedAt
) {
}
