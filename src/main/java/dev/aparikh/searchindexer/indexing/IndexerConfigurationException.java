package dev.aparikh.searchindexer.indexing;

/**
 * An indexer definition that can never produce documents, e.g. one without a {@code type} meta entry
 * or a computed field with no function behind it.
 */
public class IndexerConfigurationException extends IndexingException {

    public IndexerConfigurationException(String message) {
        super(message);
    }
}
