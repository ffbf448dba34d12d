package dev.aparikh.searchindexer.indexing;

import java.time.Clock;
import java.time.Instant;

/**
 * The watermark of one reindex pass. Every document written by the pass is stamped no earlier than
 * {@code startedAt}, so same-type documents stamped earlier were not refreshed and are stale.
 */
public record IndexRun(Instant startedAt, String typeTag) {

    static IndexRun start(String typeTag, Clock clock) {
        return new IndexRun(SystemFields.now(clock), typeTag);
    }

    public IndexQuery staleDocumentsQuery() {
        return IndexQuery.eq(SystemFields.TYPE, typeTag)
                .and(IndexQuery.lt(SystemFields.INDEX_TIMESTAMP, startedAt));
    }
}
