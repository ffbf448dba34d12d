package dev.aparikh.searchindexer.indexing.resolve;

import java.util.Optional;

/**
 * A structured record that exposes its attributes by name.
 */
public interface AttributeSource {

    /**
     * @return the attribute value, or empty when the record has no such attribute or it is unset
     */
    Optional<Object> attribute(String name);
}
