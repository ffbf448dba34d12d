package dev.aparikh.searchindexer.indexing;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot of the field names a backend index accepts.
 */
public interface IndexSchema {

    Optional<FieldMetadata> matchField(String name);

    /**
     * Fails with {@link SchemaBindingException} naming every field the schema cannot resolve.
     */
    default void checkFields(Collection<String> names) {
        List<String> unknown = names.stream()
                .filter(name -> matchField(name).isEmpty())
                .toList();
        if (!unknown.isEmpty()) {
            throw new SchemaBindingException(unknown);
        }
    }
}
