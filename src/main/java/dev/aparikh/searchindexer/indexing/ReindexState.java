package dev.aparikh.searchindexer.indexing;

public enum ReindexState {
    STARTED,
    STREAMING,
    FLUSHING,
    COMMITTED,
    RECONCILED,
    DONE
}
