package dev.aparikh.searchindexer.indexing.resolve;

import java.util.Map;
import java.util.Optional;

/**
 * Treats a {@link Map} as a structured record keyed by attribute name.
 */
public class MapAttributeResolver implements AttributeResolver {

    @Override
    public boolean supports(Object target) {
        return target instanceof Map<?, ?>;
    }

    @Override
    public Optional<Object> resolve(Object target, String name) {
        return Optional.ofNullable(((Map<?, ?>) target).get(name));
    }
}
