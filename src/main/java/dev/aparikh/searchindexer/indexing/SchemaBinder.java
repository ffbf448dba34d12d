package dev.aparikh.searchindexer.indexing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves an indexer definition against the live index schema before any document is written.
 */
public class SchemaBinder {

    private static final Logger log = LoggerFactory.getLogger(SchemaBinder.class);

    private final boolean validateSchema;

    public SchemaBinder(boolean validateSchema) {
        this.validateSchema = validateSchema;
    }

    /**
     * Binds the declared fields plus {@link SystemFields}, declared fields first.
     *
     * @throws SchemaBindingException         when validation is on and a field is unknown to the schema
     * @throws IndexerConfigurationException  when a computed field has no function under its lookup name
     */
    public <R> List<FieldBinding<R>> bind(IndexerDefinition<R> definition, IndexSchema schema, Clock clock) {
        Map<String, FieldSpec> specs = new LinkedHashMap<>(definition.fields());
        specs.putAll(SystemFields.specs());

        Map<String, ComputedValue<R>> computedValues = new LinkedHashMap<>(definition.computedValues());
        computedValues.putAll(SystemFields.computedValues(definition.typeTag(), clock));

        List<String> unknown = new ArrayList<>();
        Map<String, FieldMetadata> metadata = new LinkedHashMap<>();
        for (String name : specs.keySet()) {
            FieldMetadata matched = schema.matchField(name).orElse(null);
            if (matched == null) {
                unknown.add(name);
                matched = FieldMetadata.declared(name);
            }
            metadata.put(name, matched);
        }

        if (validateSchema) {
            if (!unknown.isEmpty()) {
                throw new SchemaBindingException(unknown);
            }
            schema.checkFields(specs.keySet());
        } else if (!unknown.isEmpty()) {
            log.warn("Indexer '{}' binds fields unknown to the index schema: {}", definition.typeTag(), unknown);
        }

        List<FieldBinding<R>> bindings = new ArrayList<>(specs.size());
        for (FieldSpec spec : specs.values()) {
            FieldMetadata fieldMetadata = metadata.get(spec.name());
            bindings.add(new FieldBinding<>(spec, fieldMetadata,
                    computedValueFor(definition, spec, fieldMetadata, computedValues)));
        }

        log.debug("Indexer '{}' bound fields {}", definition.typeTag(), specs.keySet());
        return List.copyOf(bindings);
    }

    private static <R> ComputedValue<R> computedValueFor(IndexerDefinition<R> definition,
                                                         FieldSpec spec,
                                                         FieldMetadata metadata,
                                                         Map<String, ComputedValue<R>> computedValues) {
        if (!spec.isComputed()) {
            return null;
        }
        String lookupName = metadata.dynamic() ? metadata.displayName() : spec.name();
        ComputedValue<R> value = computedValues.get(lookupName);
        if (value == null) {
            throw new IndexerConfigurationException("Indexer '" + definition.typeTag() + "' declares field '"
                    + spec.name() + "' with neither an attribute path nor a computed value named '" + lookupName + "'");
        }
        return value;
    }
}
