package dev.aparikh.searchindexer.solr;

import dev.aparikh.searchindexer.indexing.IndexQuery;
import org.apache.solr.client.solrj.util.ClientUtils;

import java.time.Instant;
import java.util.Date;

/**
 * Renders {@link IndexQuery} predicates in Solr's standard query syntax.
 */
final class SolrQueryRenderer {

    private SolrQueryRenderer() {
    }

    static String render(IndexQuery query) {
        if (query instanceof IndexQuery.Equals eq) {
            return eq.field() + ":\"" + ClientUtils.escapeQueryChars(format(eq.value())) + "\"";
        }
        if (query instanceof IndexQuery.LessThan lt) {
            // exclusive upper bound
            return lt.field() + ":{* TO " + rangeTerm(lt.value()) + "}";
        }
        if (query instanceof IndexQuery.And and) {
            return "(" + render(and.left()) + ") AND (" + render(and.right()) + ")";
        }
        throw new IllegalArgumentException("Unsupported query: " + query);
    }

    private static String rangeTerm(Object value) {
        if (value instanceof Instant || value instanceof Date || value instanceof Number) {
            return format(value); // ISO-8601 with Z accepted by Solr
        }
        return "\"" + ClientUtils.escapeQueryChars(format(value)) + "\"";
    }

    private static String format(Object value) {
        if (value instanceof Date date) return date.toInstant().toString();
        return value.toString();
    }
}
