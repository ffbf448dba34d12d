package dev.aparikh.searchindexer.indexing;

import java.util.Arrays;
import java.util.List;

/**
 * One mapping rule: a document field filled either by walking a dotted attribute path on the record
 * or, when {@code attributePath} is null, by a registered {@link ComputedValue}.
 */
public record FieldSpec(String name, String attributePath, boolean optional) {

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("field name must be provided");
        }
        if (attributePath != null && (attributePath.isBlank() || Arrays.asList(attributePath.split("\\.", -1)).contains(""))) {
            throw new IllegalArgumentException("invalid attribute path for field " + name + ": '" + attributePath + "'");
        }
    }

    public static FieldSpec attribute(String name) {
        return new FieldSpec(name, name, false);
    }

    public static FieldSpec attribute(String name, String attributePath) {
        return new FieldSpec(name, attributePath, false);
    }

    public static FieldSpec computed(String name) {
        return new FieldSpec(name, null, false);
    }

    public FieldSpec asOptional() {
        return new FieldSpec(name, attributePath, true);
    }

    public boolean isComputed() {
        return attributePath == null;
    }

    public List<String> pathSegments() {
        return isComputed() ? List.of() : List.of(attributePath.split("\\."));
    }
}
