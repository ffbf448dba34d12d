package dev.aparikh.searchindexer.indexing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Transforms records of one {@link IndexerDefinition} and writes them to an {@link IndexBackend}.
 *
 * <p>Field bindings are resolved against the backend schema when the indexer is constructed, so
 * mapping mistakes fail before any write. If a document id already exists, {@code add} overwrites it.
 * Not thread-safe.
 */
public class BatchIndexer<R> {

    private static final Logger log = LoggerFactory.getLogger(BatchIndexer.class);

    private final IndexBackend backend;
    private final IndexerDefinition<R> definition;
    private final IndexerSettings settings;
    private final DocumentTransformer<R> transformer;

    public BatchIndexer(IndexBackend backend, IndexerDefinition<R> definition) {
        this(backend, definition, IndexerSettings.defaults());
    }

    public BatchIndexer(IndexBackend backend, IndexerDefinition<R> definition, IndexerSettings settings) {
        this.backend = backend;
        this.definition = definition;
        this.settings = settings;
        List<FieldBinding<R>> bindings = new SchemaBinder(settings.validateSchema())
                .bind(definition, backend.schema(), settings.clock());
        this.transformer = new DocumentTransformer<>(bindings, definition.idField(),
                settings.attributeResolver(), settings.emptyValuePolicy());
    }

    public IndexDocument transform(R record) {
        return transformer.transform(record);
    }

    public void add(R record) {
        add(Collections.singletonList(record), true);
    }

    public void add(List<? extends R> records) {
        add(records, true);
    }

    public void add(List<? extends R> records, boolean commit) {
        if (records == null || records.isEmpty()) return;
        List<IndexDocument> documents = records.stream()
                .map(transformer::transform)
                .toList();
        backend.add(documents);
        if (commit) {
            backend.commit();
        }
    }

    public void update(R record) {
        add(Collections.singletonList(record), true);
    }

    public void update(List<? extends R> records) {
        add(records, true);
    }

    /**
     * Same as {@link #add(List, boolean)} with a commit always issued; overwriting is left to the backend.
     */
    public void update(List<? extends R> records, boolean commit) {
        add(records, true);
    }

    public void delete(R record) {
        delete(Collections.singletonList(record), true);
    }

    public void delete(List<? extends R> records) {
        delete(records, true);
    }

    public void delete(List<? extends R> records, boolean commit) {
        if (records == null || records.isEmpty()) return;
        List<Object> ids = records.stream()
                .map(transformer::identify)
                .toList();
        backend.deleteByIds(ids);
        if (commit) {
            backend.commit();
        }
    }

    /**
     * Streams records into the index in chunks of {@link IndexerSettings#commitChunkSize()} documents.
     * Does not commit.
     *
     * @return the number of records transformed and added
     */
    public long index(Stream<? extends R> records) {
        Chunk chunk = openChunk();
        records.forEachOrdered(chunk::append);
        chunk.flush();
        return chunk.count();
    }

    public void commit() {
        backend.commit();
    }

    public void deleteByQuery(IndexQuery query) {
        backend.deleteByQuery(query);
    }

    public IndexerDefinition<R> definition() {
        return definition;
    }

    public IndexerSettings settings() {
        return settings;
    }

    Chunk openChunk() {
        return new Chunk();
    }

    /**
     * Pending documents of a streaming pass. Chunk boundaries bound request size only; nothing is
     * committed when a chunk is sent.
     */
    final class Chunk {
        private final List<IndexDocument> documents = new ArrayList<>();
        private long count;

        void append(R record) {
            documents.add(transformer.transform(record));
            count++;
            if (documents.size() >= settings.commitChunkSize()) {
                flush();
            }
        }

        void flush() {
            if (documents.isEmpty()) return;
            log.debug("Sending {} '{}' documents ({} so far)", documents.size(), definition.typeTag(), count);
            backend.add(List.copyOf(documents));
            documents.clear();
        }

        long count() {
            return count;
        }
    }
}
