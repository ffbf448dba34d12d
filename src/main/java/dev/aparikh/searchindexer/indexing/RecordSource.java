package dev.aparikh.searchindexer.indexing;

import java.util.stream.Stream;

/**
 * Supplies the records of one indexer type, typically backed by a database cursor or an API client.
 * The stream is lazy and finite, consumed once and closed by the caller.
 */
@FunctionalInterface
public interface RecordSource<R> {

    Stream<R> records();
}
