package dev.aparikh.searchindexer.reindex;

public class UnknownIndexerException extends RuntimeException {

    public UnknownIndexerException(String type) {
        super("No indexer registered for type '" + type + "'");
    }
}
