package dev.aparikh.searchindexer.indexing.resolve;

import java.util.Optional;

public class SourceAttributeResolver implements AttributeResolver {

    @Override
    public boolean supports(Object target) {
        return target instanceof AttributeSource;
    }

    @Override
    public Optional<Object> resolve(Object target, String name) {
        Optional<Object> value = ((AttributeSource) target).attribute(name);
        return value == null ? Optional.empty() : value;
    }
}
