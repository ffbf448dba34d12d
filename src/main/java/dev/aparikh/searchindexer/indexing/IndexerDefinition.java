package dev.aparikh.searchindexer.indexing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declares how records of one logical type map onto index documents.
 *
 * <p>A definition holds a {@code meta} map whose {@code type} entry tags every document it writes
 * (and scopes reconciliation), the declared fields in order, and the functions behind computed
 * fields. Definitions are immutable; {@link #extend()} starts a builder from a copy of this one so a
 * subtype can add or override entries by name:
 *
 * <pre>{@code
 * IndexerDefinition<Article> articles = IndexerDefinition.<Article>builder()
 *         .type("article")
 *         .attribute("id")
 *         .attribute("title")
 *         .optionalAttribute("author_s", "author.name")
 *         .build();
 *
 * IndexerDefinition<Article> news = articles.extend()
 *         .type("news")
 *         .computed("headline", a -> a.title().toUpperCase(Locale.ROOT))
 *         .build();
 * }</pre>
 */
public final class IndexerDefinition<R> {

    public static final String TYPE_KEY = "type";
    public static final String DEFAULT_ID_FIELD = "id";

    private final Map<String, Object> meta;
    private final Map<String, FieldSpec> fields;
    private final Map<String, ComputedValue<R>> computedValues;
    private final String idField;

    private IndexerDefinition(Builder<R> builder) {
        this.meta = Collections.unmodifiableMap(new LinkedHashMap<>(builder.meta));
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.computedValues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.computedValues));
        this.idField = builder.idField;
    }

    public static <R> Builder<R> builder() {
        return new Builder<>();
    }

    public Builder<R> extend() {
        Builder<R> builder = new Builder<>();
        builder.meta.putAll(meta);
        builder.fields.putAll(fields);
        builder.computedValues.putAll(computedValues);
        builder.idField = idField;
        return builder;
    }

    public String typeTag() {
        return (String) meta.get(TYPE_KEY);
    }

    public Map<String, Object> meta() {
        return meta;
    }

    public Map<String, FieldSpec> fields() {
        return fields;
    }

    public Map<String, ComputedValue<R>> computedValues() {
        return computedValues;
    }

    public String idField() {
        return idField;
    }

    @Override
    public String toString() {
        return "IndexerDefinition[type=" + typeTag() + ", fields=" + fields.keySet() + "]";
    }

    public static final class Builder<R> {
        private final Map<String, Object> meta = new LinkedHashMap<>();
        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
        private final Map<String, ComputedValue<R>> computedValues = new LinkedHashMap<>();
        private String idField = DEFAULT_ID_FIELD;

        private Builder() {
        }

        public Builder<R> type(String type) {
            return meta(TYPE_KEY, type);
        }

        public Builder<R> meta(String key, Object value) {
            this.meta.put(key, value);
            return this;
        }

        public Builder<R> field(FieldSpec field) {
            if (SystemFields.NAMES.contains(field.name())) {
                throw new IndexerConfigurationException(
                        "Field '" + field.name() + "' is reserved and always written by the indexer");
            }
            this.fields.put(field.name(), field);
            return this;
        }

        public Builder<R> attribute(String name) {
            return field(FieldSpec.attribute(name));
        }

        public Builder<R> attribute(String name, String attributePath) {
            return field(FieldSpec.attribute(name, attributePath));
        }

        public Builder<R> optionalAttribute(String name, String attributePath) {
            return field(FieldSpec.attribute(name, attributePath).asOptional());
        }

        public Builder<R> computed(String name, ComputedValue<R> value) {
            field(FieldSpec.computed(name));
            return computedValue(name, value);
        }

        public Builder<R> optionalComputed(String name, ComputedValue<R> value) {
            field(FieldSpec.computed(name).asOptional());
            return computedValue(name, value);
        }

        /**
         * Registers a function without declaring a field. Dynamic fields look their function up by
         * the schema's display name, so {@code category_s} is served by a function named {@code category}.
         */
        public Builder<R> computedValue(String name, ComputedValue<R> value) {
            if (value == null) {
                throw new IllegalArgumentException("computed value for '" + name + "' must not be null");
            }
            this.computedValues.put(name, value);
            return this;
        }

        public Builder<R> idField(String idField) {
            this.idField = idField;
            return this;
        }

        public IndexerDefinition<R> build() {
            Object type = meta.get(TYPE_KEY);
            if (!(type instanceof String tag) || tag.isBlank()) {
                throw new IndexerConfigurationException(
                        "Indexer definition requires a '" + TYPE_KEY + "' meta entry to group its documents");
            }
            if (idField == null || idField.isBlank()) {
                throw new IndexerConfigurationException("Indexer definition '" + tag + "' has a blank id field");
            }
            return new IndexerDefinition<>(this);
        }
    }
}
