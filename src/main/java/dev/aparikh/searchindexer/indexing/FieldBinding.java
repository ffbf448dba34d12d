package dev.aparikh.searchindexer.indexing;

/**
 * A declared field joined with its schema metadata and, for computed fields, the function that fills it.
 */
public record FieldBinding<R>(FieldSpec spec, FieldMetadata metadata, ComputedValue<R> computedValue) {

    public String name() {
        return spec.name();
    }

    public boolean optional() {
        return spec.optional();
    }
}
