package dev.aparikh.searchindexer.indexing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Backend double keyed by the {@code id} field. Adds become visible on commit; deletes apply at once.
 */
class InMemoryIndexBackend implements IndexBackend {

    private final Set<String> declaredFields;
    private final List<String> dynamicSuffixes;
    private final Map<Object, IndexDocument> pending = new LinkedHashMap<>();
    private final Map<Object, IndexDocument> committed = new LinkedHashMap<>();

    final List<Integer> addSizes = new ArrayList<>();
    final List<IndexQuery> deleteQueries = new ArrayList<>();
    int commits;

    InMemoryIndexBackend(Set<String> declaredFields, List<String> dynamicSuffixes) {
        this.declaredFields = declaredFields;
        this.dynamicSuffixes = dynamicSuffixes;
    }

    static InMemoryIndexBackend withFields(String... declaredFields) {
        return new InMemoryIndexBackend(Set.of(declaredFields), List.of("_s", "_dt", "_i", "_ss"));
    }

    /**
     * Evaluates a delete predicate against stored field values. Multi-valued fields match when any value does.
     */
    static boolean matches(IndexQuery query, Map<String, ?> document) {
        if (query instanceof IndexQuery.Equals eq) {
            return anyValue(document.get(eq.field()), eq.value()::equals);
        }
        if (query instanceof IndexQuery.LessThan lt) {
            return anyValue(document.get(lt.field()), stored -> isBelow(stored, lt.value()));
        }
        IndexQuery.And and = (IndexQuery.And) query;
        return matches(and.left(), document) && matches(and.right(), document);
    }

    @SuppressWarnings("unchecked")
    private static boolean isBelow(Object stored, Comparable<?> bound) {
        return bound.getClass().isInstance(stored) && ((Comparable<Object>) stored).compareTo(bound) < 0;
    }

    private static boolean anyValue(Object stored, Predicate<Object> test) {
        if (stored == null) return false;
        if (stored instanceof Collection<?> values) {
            return values.stream().filter(Objects::nonNull).anyMatch(test);
        }
        return test.test(stored);
    }

    @Override
    public IndexSchema schema() {
        return name -> {
            if (declaredFields.contains(name)) {
                return Optional.of(FieldMetadata.declared(name));
            }
            return dynamicSuffixes.stream()
                    .filter(suffix -> name.endsWith(suffix) && name.length() > suffix.length())
                    .findFirst()
                    .map(suffix -> FieldMetadata.dynamic(name, name.substring(0, name.length() - suffix.length())));
        };
    }

    @Override
    public void add(List<IndexDocument> documents) {
        addSizes.add(documents.size());
        for (IndexDocument document : documents) {
            pending.put(document.get("id"), document);
        }
    }

    @Override
    public void commit() {
        commits++;
        committed.putAll(pending);
        pending.clear();
    }

    @Override
    public void deleteByIds(List<?> ids) {
        ids.forEach(id -> {
            pending.remove(id);
            committed.remove(id);
        });
    }

    @Override
    public void deleteByQuery(IndexQuery query) {
        deleteQueries.add(query);
        pending.values().removeIf(d -> matches(query, d.fields()));
        committed.values().removeIf(d -> matches(query, d.fields()));
    }

    void seed(IndexDocument document) {
        committed.put(document.get("id"), document);
    }

    Map<Object, IndexDocument> committed() {
        return committed;
    }

    long countOfType(String type) {
        return committed.values().stream()
                .filter(d -> type.equals(d.get(SystemFields.TYPE)))
                .count();
    }
}
