package dev.aparikh.searchindexer.indexing;

/**
 * Base type for every failure raised while defining, binding or running an indexer.
 */
public class IndexingException extends RuntimeException {

    public IndexingException(String message) {
        super(message);
    }

    public IndexingException(String message, Throwable cause) {
        super(message, cause);
    }
}
