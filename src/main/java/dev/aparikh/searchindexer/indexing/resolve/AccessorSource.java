package dev.aparikh.searchindexer.indexing.resolve;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * A value that exposes named zero-argument accessors, evaluated each time a path walks through them.
 */
public interface AccessorSource {

    Optional<Supplier<?>> accessor(String name);
}
