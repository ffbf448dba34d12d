package dev.aparikh.searchindexer.indexing;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The two fields every indexer writes regardless of its definition. Reconciliation deletes by them.
 */
public final class SystemFields {

    public static final String TYPE = "meta_type_s";
    public static final String INDEX_TIMESTAMP = "meta_index_timestamp_dt";

    static final Set<String> NAMES = Set.of(TYPE, INDEX_TIMESTAMP);

    private static final String TYPE_DISPLAY_NAME = "meta_type";
    private static final String INDEX_TIMESTAMP_DISPLAY_NAME = "meta_index_timestamp";

    private SystemFields() {
    }

    static Map<String, FieldSpec> specs() {
        Map<String, FieldSpec> specs = new LinkedHashMap<>();
        specs.put(TYPE, FieldSpec.computed(TYPE));
        specs.put(INDEX_TIMESTAMP, FieldSpec.computed(INDEX_TIMESTAMP));
        return specs;
    }

    /**
     * Built-in functions, registered under both full and display names so the fields bind whether the
     * schema declares them or covers them through {@code *_s} and {@code *_dt} rules.
     */
    static <R> Map<String, ComputedValue<R>> computedValues(String typeTag, Clock clock) {
        ComputedValue<R> type = record -> typeTag;
        ComputedValue<R> timestamp = record -> now(clock);
        Map<String, ComputedValue<R>> values = new LinkedHashMap<>();
        values.put(TYPE, type);
        values.put(TYPE_DISPLAY_NAME, type);
        values.put(INDEX_TIMESTAMP, timestamp);
        values.put(INDEX_TIMESTAMP_DISPLAY_NAME, timestamp);
        return values;
    }

    /**
     * Millisecond precision, which is what Solr stores; a stored timestamp can then never fall below the
     * watermark it was compared against.
     */
    static Instant now(Clock clock) {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
