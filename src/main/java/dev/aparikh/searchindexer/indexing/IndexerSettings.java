package dev.aparikh.searchindexer.indexing;

import dev.aparikh.searchindexer.indexing.resolve.AttributeResolver;

import java.time.Clock;
import java.util.Objects;

/**
 * Per-instance knobs of an indexer.
 *
 * @param commitChunkSize   maximum number of documents sent in one add call while streaming
 * @param validateSchema    fail construction when a field is unknown to the index schema
 * @param emptyValuePolicy  which resolved values are left out of documents
 * @param clock             source of the run watermark and per-document index timestamps
 * @param attributeResolver how attribute path segments are looked up
 */
public record IndexerSettings(
        int commitChunkSize,
        boolean validateSchema,
        EmptyValuePolicy emptyValuePolicy,
        Clock clock,
        AttributeResolver attributeResolver
) {
    public static final int DEFAULT_COMMIT_CHUNK_SIZE = 1000;

    public IndexerSettings {
        if (commitChunkSize <= 0) {
            throw new IllegalArgumentException("commitChunkSize must be > 0");
        }
        Objects.requireNonNull(emptyValuePolicy, "emptyValuePolicy");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(attributeResolver, "attributeResolver");
    }

    public static IndexerSettings defaults() {
        return new IndexerSettings(DEFAULT_COMMIT_CHUNK_SIZE, true, EmptyValuePolicy.FALSY,
                Clock.systemUTC(), AttributeResolver.defaults());
    }

    public IndexerSettings withCommitChunkSize(int commitChunkSize) {
        return new IndexerSettings(commitChunkSize, validateSchema, emptyValuePolicy, clock, attributeResolver);
    }

    public IndexerSettings withValidateSchema(boolean validateSchema) {
        return new IndexerSettings(commitChunkSize, validateSchema, emptyValuePolicy, clock, attributeResolver);
    }

    public IndexerSettings withEmptyValuePolicy(EmptyValuePolicy emptyValuePolicy) {
        return new IndexerSettings(commitChunkSize, validateSchema, emptyValuePolicy, clock, attributeResolver);
    }

    public IndexerSettings withClock(Clock clock) {
        return new IndexerSettings(commitChunkSize, validateSchema, emptyValuePolicy, clock, attributeResolver);
    }

    public IndexerSettings withAttributeResolver(AttributeResolver attributeResolver) {
        return new IndexerSettings(commitChunkSize, validateSchema, emptyValuePolicy, clock, attributeResolver);
    }
}
