package dev.aparikh.searchindexer.indexing.resolve;

import java.util.List;
import java.util.Optional;

/**
 * Resolves one segment of an attribute path against the current value.
 */
public interface AttributeResolver {

    boolean supports(Object target);

    /**
     * @return the value of {@code name} on {@code target}; empty when missing or null
     */
    Optional<Object> resolve(Object target, String name);

    /**
     * Attribute-or-accessor lookup over {@link AttributeSource}, {@link AccessorSource} and {@link java.util.Map}
     * values, tried in that order.
     */
    static AttributeResolver defaults() {
        return new CompositeAttributeResolver(List.of(
                new SourceAttributeResolver(),
                new AccessorAttributeResolver(),
                new MapAttributeResolver()));
    }
}
