package dev.aparikh.searchindexer.indexing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A flat document ready to be written to the index. Sparse: a missing key means "not set".
 */
public record IndexDocument(Map<String, Object> fields) {

    public IndexDocument {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String name) {
        return fields.get(name);
    }

    public boolean containsField(String name) {
        return fields.containsKey(name);
    }
}
