package dev.aparikh.searchindexer.indexing;

/**
 * A record did not yield a value for a field. Optional fields swallow this and are left out of the
 * document; required fields let it abort the record.
 */
public class FieldResolutionException extends IndexingException {

    private final transient Object record;
    private final String path;
    private final String segment;

    public FieldResolutionException(Object record, String path, String segment) {
        super("Record " + record + " does not contain " + path + " (failed resolving '" + segment + "')");
        this.record = record;
        this.path = path;
        this.segment = segment;
    }

    /**
     * For computed values that find their input missing.
     */
    public FieldResolutionException(Object record, String message) {
        super(message);
        this.record = record;
        this.path = null;
        this.segment = null;
    }

    public Object getRecord() {
        return record;
    }

    public String getPath() {
        return path;
    }

    public String getSegment() {
        return segment;
    }
}
