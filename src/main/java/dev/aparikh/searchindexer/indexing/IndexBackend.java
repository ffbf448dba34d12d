package dev.aparikh.searchindexer.indexing;

import java.util.List;

/**
 * The search engine as seen by the indexers. Every call blocks; failures surface as
 * {@link IndexBackendException} and are never retried here.
 */
public interface IndexBackend {

    /**
     * Reads the live schema. Each call returns a fresh snapshot since the schema may change between runs.
     */
    IndexSchema schema();

    void add(List<IndexDocument> documents);

    void commit();

    void deleteByIds(List<?> ids);

    void deleteByQuery(IndexQuery query);
}
