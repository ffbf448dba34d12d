package dev.aparikh.searchindexer.indexing;

import dev.aparikh.searchindexer.indexing.resolve.AttributeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns one record into a sparse {@link IndexDocument} using bound fields.
 *
 * <p>A field with an attribute path is filled by walking the path segment by segment; every segment
 * must resolve to a non-null value. A field without a path calls the {@link ComputedValue} it was bound
 * to. Optional fields whose resolution fails are left out. Required ones let the
 * {@link FieldResolutionException} propagate and no document is produced for the record.
 */
public class DocumentTransformer<R> {

    private static final Logger log = LoggerFactory.getLogger(DocumentTransformer.class);

    private final List<FieldBinding<R>> bindings;
    private final FieldBinding<R> idBinding;
    private final AttributeResolver attributeResolver;
    private final EmptyValuePolicy emptyValuePolicy;

    public DocumentTransformer(List<FieldBinding<R>> bindings,
                               String idField,
                               AttributeResolver attributeResolver,
                               EmptyValuePolicy emptyValuePolicy) {
        this.bindings = List.copyOf(bindings);
        this.idBinding = this.bindings.stream()
                .filter(b -> b.name().equals(idField))
                .findFirst()
                .orElse(null);
        this.attributeResolver = attributeResolver;
        this.emptyValuePolicy = emptyValuePolicy;
    }

    public IndexDocument transform(R record) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldBinding<R> binding : bindings) {
            Object value;
            try {
                value = resolve(binding, record);
            } catch (FieldResolutionException e) {
                if (!binding.optional()) {
                    throw e;
                }
                log.debug("Omitting optional field '{}': {}", binding.name(), e.getMessage());
                continue;
            }
            if (!emptyValuePolicy.isEmpty(value)) {
                fields.put(binding.name(), value);
            }
        }
        return new IndexDocument(fields);
    }

    /**
     * Resolves only the id field, for delete-by-id. The id is required even if declared optional.
     */
    public Object identify(R record) {
        if (idBinding == null) {
            throw new IndexerConfigurationException("No field is bound as the document id");
        }
        Object id = resolve(idBinding, record);
        if (emptyValuePolicy.isEmpty(id)) {
            throw new FieldResolutionException(record, "Record " + record + " has an empty id '" + idBinding.name() + "'");
        }
        return id;
    }

    private Object resolve(FieldBinding<R> binding, R record) {
        FieldSpec spec = binding.spec();
        if (spec.isComputed()) {
            return binding.computedValue().compute(record);
        }
        Object value = record;
        for (String segment : spec.pathSegments()) {
            if (value == null || !attributeResolver.supports(value)) {
                throw new FieldResolutionException(record, spec.attributePath(), segment);
            }
            value = attributeResolver.resolve(value, segment)
                    .orElseThrow(() -> new FieldResolutionException(record, spec.attributePath(), segment));
        }
        return value;
    }
}
