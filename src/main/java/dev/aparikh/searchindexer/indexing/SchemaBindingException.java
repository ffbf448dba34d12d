package dev.aparikh.searchindexer.indexing;

import java.util.List;

/**
 * One or more declared fields are unknown to the live index schema.
 */
public class SchemaBindingException extends IndexingException {

    private final List<String> unknownFields;

    public SchemaBindingException(List<String> unknownFields) {
        super("Fields not defined in the index schema: " + unknownFields);
        this.unknownFields = List.copyOf(unknownFields);
    }

    public List<String> getUnknownFields() {
        return unknownFields;
    }
}
