package dev.aparikh.searchindexer.indexing;

/**
 * A write or schema call to the search backend failed. Never retried by the indexers.
 */
public class IndexBackendException extends IndexingException {

    public IndexBackendException(String message) {
        super(message);
    }

    public IndexBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
