package dev.aparikh.searchindexer.indexing.resolve;

import java.util.List;
import java.util.Optional;

/**
 * Asks each supporting delegate in turn; the first non-empty answer wins. A value that implements both
 * {@link AttributeSource} and {@link AccessorSource} thus falls back from attributes to accessors.
 */
public class CompositeAttributeResolver implements AttributeResolver {

    private final List<AttributeResolver> delegates;

    public CompositeAttributeResolver(List<AttributeResolver> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public boolean supports(Object target) {
        return delegates.stream().anyMatch(d -> d.supports(target));
    }

    @Override
    public Optional<Object> resolve(Object target, String name) {
        for (AttributeResolver delegate : delegates) {
            if (!delegate.supports(target)) continue;
            Optional<Object> value = delegate.resolve(target, name);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
