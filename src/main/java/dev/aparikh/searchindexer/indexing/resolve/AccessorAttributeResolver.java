package dev.aparikh.searchindexer.indexing.resolve;

import java.util.Optional;
import java.util.function.Supplier;

public class AccessorAttributeResolver implements AttributeResolver {

    @Override
    public boolean supports(Object target) {
        return target instanceof AccessorSource;
    }

    @Override
    public Optional<Object> resolve(Object target, String name) {
        Optional<Supplier<?>> accessor = ((AccessorSource) target).accessor(name);
        if (accessor == null || accessor.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(accessor.get().get());
    }
}
