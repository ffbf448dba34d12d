package dev.aparikh.searchindexer.reindex;

/**
 * A second reindex of a type was requested while one is running. Two overlapping passes would
 * delete each other's documents.
 */
public class ReindexInProgressException extends RuntimeException {

    public ReindexInProgressException(String type) {
        super("A reindex of '" + type + "' is already running");
    }
}
