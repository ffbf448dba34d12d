package dev.aparikh.searchindexer.indexing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.stream.Stream;

/**
 * Rebuilds every document of one indexer type from its {@link RecordSource}, then deletes the
 * documents of that type the pass did not refresh.
 *
 * <p>The watermark is taken when the reindexer is constructed. Records are streamed in chunks with a
 * single commit at the end, after which one delete-by-query removes documents tagged with the same type
 * whose index timestamp predates the watermark. Records whose transformation fails are not refreshed
 * and the failure aborts the pass; a rerun sweeps them once they are gone from the source.
 *
 * <p>One instance runs one pass. Concurrent passes for the same type tag must be prevented by the
 * caller: each would delete the documents the other is writing.
 */
public class ReconcilingReindexer<R> {

    private static final Logger log = LoggerFactory.getLogger(ReconcilingReindexer.class);

    private final BatchIndexer<R> indexer;
    private final RecordSource<? extends R> source;
    private final IndexRun run;
    private ReindexState state;

    public ReconcilingReindexer(BatchIndexer<R> indexer, RecordSource<? extends R> source) {
        this.indexer = indexer;
        this.source = source;
        this.run = IndexRun.start(indexer.definition().typeTag(), indexer.settings().clock());
        this.state = ReindexState.STARTED;
    }

    /**
     * @return the number of records transformed and added
     * @throws IllegalStateException when this instance already ran
     */
    public long reindex() {
        if (state != ReindexState.STARTED) {
            throw new IllegalStateException("Reindex of '" + run.typeTag() + "' already ran (state " + state + ")");
        }
        log.info("Reindexing '{}' with watermark {}", run.typeTag(), run.startedAt());

        state = ReindexState.STREAMING;
        BatchIndexer<R>.Chunk chunk = indexer.openChunk();
        try (Stream<? extends R> records = source.records()) {
            records.forEachOrdered(chunk::append);
        }

        state = ReindexState.FLUSHING;
        chunk.flush();

        indexer.commit();
        state = ReindexState.COMMITTED;

        indexer.deleteByQuery(run.staleDocumentsQuery());
        state = ReindexState.RECONCILED;
        log.info("Deleted '{}' documents indexed before {}", run.typeTag(), run.startedAt());

        state = ReindexState.DONE;
        Duration took = Duration.between(run.startedAt(), indexer.settings().clock().instant());
        log.info("Reindexed {} '{}' records in {} ms", chunk.count(), run.typeTag(), took.toMillis());
        return chunk.count();
    }

    public IndexQuery reconciliationQuery() {
        return run.staleDocumentsQuery();
    }

    public IndexRun run() {
        return run;
    }

    public ReindexState state() {
        return state;
    }
}
