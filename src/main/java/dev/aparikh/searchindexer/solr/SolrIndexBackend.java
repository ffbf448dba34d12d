package dev.aparikh.searchindexer.solr;

import dev.aparikh.searchindexer.indexing.IndexBackend;
import dev.aparikh.searchindexer.indexing.IndexBackendException;
import dev.aparikh.searchindexer.indexing.IndexDocument;
import dev.aparikh.searchindexer.indexing.IndexQuery;
import dev.aparikh.searchindexer.indexing.IndexSchema;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.SolrInputDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;

public class SolrIndexBackend implements IndexBackend {

    private static final Logger log = LoggerFactory.getLogger(SolrIndexBackend.class);

    private final SolrClient solr;

    public SolrIndexBackend(SolrClient solr) {
        this.solr = solr;
    }

    @Override
    public IndexSchema schema() {
        return SolrIndexSchema.load(solr);
    }

    @Override
    public void add(List<IndexDocument> documents) {
        try {
            List<SolrInputDocument> docs = documents.stream()
                    .map(SolrIndexBackend::toSolrDoc)
                    .toList();
            solr.add(docs);
        } catch (SolrServerException | IOException | SolrException e) {
            throw new IndexBackendException("Failed to add " + documents.size() + " documents", e);
        }
    }

    @Override
    public void commit() {
        try {
            solr.commit();
        } catch (SolrServerException | IOException | SolrException e) {
            throw new IndexBackendException("Failed to commit", e);
        }
    }

    @Override
    public void deleteByIds(List<?> ids) {
        try {
            solr.deleteById(ids.stream().map(String::valueOf).toList());
        } catch (SolrServerException | IOException | SolrException e) {
            throw new IndexBackendException("Failed to delete " + ids.size() + " documents by id", e);
        }
    }

    @Override
    public void deleteByQuery(IndexQuery query) {
        String q = SolrQueryRenderer.render(query);
        log.debug("Deleting by query {}", q);
        try {
            solr.deleteByQuery(q);
        } catch (SolrServerException | IOException | SolrException e) {
            throw new IndexBackendException("Failed to delete by query " + q, e);
        }
    }

    /**
     * Collections and arrays become multi-valued fields; {@code byte[]} stays a single binary value.
     * Map values are rejected since Solr reads a map as an atomic update instruction.
     */
    static SolrInputDocument toSolrDoc(IndexDocument document) {
        SolrInputDocument d = new SolrInputDocument();
        for (Map.Entry<String, Object> field : document.fields().entrySet()) {
            Object value = field.getValue();
            if (value instanceof Map<?, ?>) {
                throw new IndexBackendException("Field '" + field.getKey() + "' holds a map value, which Solr "
                        + "would treat as an atomic update; map it to a flat value instead");
            }
            List<?> values = multiValues(value);
            if (values == null) {
                d.addField(field.getKey(), toSolrValue(value));
                continue;
            }
            for (Object v : values) {
                if (v != null) d.addField(field.getKey(), toSolrValue(v));
            }
        }
        return d;
    }

    private static List<?> multiValues(Object value) {
        if (value instanceof Collection<?> c) return new ArrayList<>(c);
        if (value instanceof Object[] a) return Arrays.asList(a);
        if (value instanceof int[] a) return Arrays.stream(a).boxed().toList();
        if (value instanceof long[] a) return Arrays.stream(a).boxed().toList();
        if (value instanceof double[] a) return Arrays.stream(a).boxed().toList();
        if (value instanceof float[] a) {
            List<Float> floats = new ArrayList<>(a.length);
            for (float f : a) floats.add(f);
            return floats;
        }
        if (value instanceof short[] a) {
            List<Short> shorts = new ArrayList<>(a.length);
            for (short v : a) shorts.add(v);
            return shorts;
        }
        if (value instanceof boolean[] a) {
            List<Boolean> booleans = new ArrayList<>(a.length);
            for (boolean b : a) booleans.add(b);
            return booleans;
        }
        if (value instanceof char[] a) {
            List<String> chars = new ArrayList<>(a.length);
            for (char c : a) chars.add(String.valueOf(c));
            return chars;
        }
        return null;
    }

    private static Object toSolrValue(Object value) {
        if (value instanceof Instant instant) return Date.from(instant);
        if (value instanceof Enum<?> e) return e.name();
        return value;
    }
}
