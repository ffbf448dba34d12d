package dev.aparikh.searchindexer.solr;

import dev.aparikh.searchindexer.indexing.FieldMetadata;
import dev.aparikh.searchindexer.indexing.IndexBackendException;
import dev.aparikh.searchindexer.indexing.IndexSchema;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.request.schema.SchemaRequest;
import org.apache.solr.client.solrj.response.schema.SchemaResponse;
import org.apache.solr.common.SolrException;

import java.io.IOException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Field names and dynamic field rules of a Solr core, read once through the Schema API.
 *
 * <p>Matching follows Solr: declared fields first, then dynamic rules ({@code *_s}, {@code attr_*}),
 * longest rule first.
 */
public class SolrIndexSchema implements IndexSchema {

    private final Set<String> fieldNames;
    private final List<String> dynamicPatterns;

    public SolrIndexSchema(Collection<String> fieldNames, Collection<String> dynamicPatterns) {
        this.fieldNames = Set.copyOf(fieldNames);
        this.dynamicPatterns = dynamicPatterns.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    static SolrIndexSchema load(SolrClient solr) {
        try {
            SchemaResponse.FieldsResponse fields = new SchemaRequest.Fields().process(solr);
            SchemaResponse.DynamicFieldsResponse dynamicFields = new SchemaRequest.DynamicFields().process(solr);
            return new SolrIndexSchema(names(fields.getFields()), names(dynamicFields.getDynamicFields()));
        } catch (SolrServerException | IOException | SolrException e) {
            throw new IndexBackendException("Failed to read the index schema", e);
        }
    }

    private static List<String> names(List<Map<String, Object>> definitions) {
        if (definitions == null) return List.of();
        return definitions.stream()
                .map(d -> d.get("name"))
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    @Override
    public Optional<FieldMetadata> matchField(String name) {
        if (fieldNames.contains(name)) {
            return Optional.of(FieldMetadata.declared(name));
        }
        for (String pattern : dynamicPatterns) {
            if (pattern.startsWith("*")) {
                String suffix = pattern.substring(1);
                if (name.length() > suffix.length() && name.endsWith(suffix)) {
                    return Optional.of(FieldMetadata.dynamic(name, name.substring(0, name.length() - suffix.length())));
                }
            } else if (pattern.endsWith("*")) {
                String prefix = pattern.substring(0, pattern.length() - 1);
                if (name.length() > prefix.length() && name.startsWith(prefix)) {
                    return Optional.of(FieldMetadata.dynamic(name, name.substring(prefix.length())));
                }
            }
        }
        return Optional.empty();
    }
}
