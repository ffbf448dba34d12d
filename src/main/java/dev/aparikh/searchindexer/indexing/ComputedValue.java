package dev.aparikh.searchindexer.indexing;

/**
 * Produces a field value from the whole record. May throw {@link FieldResolutionException} when its
 * input is missing, which optional fields tolerate.
 */
@FunctionalInterface
public interface ComputedValue<R> {

    Object compute(R record);
}
