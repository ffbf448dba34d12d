package dev.aparikh.searchindexer.indexing;

import dev.aparikh.searchindexer.indexing.resolve.AttributeResolver;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentTransformerTest {

    private final TickingClock clock = TickingClock.startingAt("2025-01-01T10:00:00Z");
    private final IndexSchema schema = InMemoryIndexBackend.withFields("id", "title", "views", "tags", "summary").schema();

    private final IndexerDefinition<Article> articles = IndexerDefinition.<Article>builder()
            .type("article")
            .attribute("id")
            .attribute("title")
            .build();

    @Test
    void transformsRequiredAttributesAndSystemFields() {
        DocumentTransformer<Article> transformer = transformer(articles, EmptyValuePolicy.FALSY);

        IndexDocument document = transformer.transform(new Article(1, "A"));

        assertThat(document.fields()).containsOnlyKeys("id", "title", SystemFields.TYPE, SystemFields.INDEX_TIMESTAMP);
        assertThat(document.get("id")).isEqualTo(1);
        assertThat(document.get("title")).isEqualTo("A");
        assertThat(document.get(SystemFields.TYPE)).isEqualTo("article");
        assertThat(document.get(SystemFields.INDEX_TIMESTAMP)).isEqualTo(Instant.parse("2025-01-01T10:00:00Z"));
    }

    @Test
    void requiredNullAttributeFailsWithFieldResolutionException() {
        DocumentTransformer<Article> transformer = transformer(articles, EmptyValuePolicy.FALSY);
        Article untitled = new Article(2, null);

        assertThatThrownBy(() -> transformer.transform(untitled))
                .isInstanceOf(FieldResolutionException.class)
                .satisfies(e -> {
                    FieldResolutionException failure = (FieldResolutionException) e;
                    assertThat(failure.getPath()).isEqualTo("title");
                    assertThat(failure.getSegment()).isEqualTo("title");
                    assertThat(failure.getRecord()).isSameAs(untitled);
                });
    }

    @Test
    void optionalMissingAttributeIsOmitted() {
        IndexerDefinition<Article> definition = articles.extend()
                .optionalAttribute("author_s", "author.lastName")
                .build();
        DocumentTransformer<Article> transformer = transformer(definition, EmptyValuePolicy.FALSY);

        IndexDocument document = transformer.transform(new Article(1, "A"));

        assertThat(document.containsField("author_s")).isFalse();
        assertThat(document.fields()).containsOnlyKeys("id", "title", SystemFields.TYPE, SystemFields.INDEX_TIMESTAMP);
    }

    @Test
    void nestedPathWalksAccessors() {
        IndexerDefinition<Article> definition = articles.extend()
                .attribute("author_s", "author.fullName")
                .build();
        DocumentTransformer<Article> transformer = transformer(definition, EmptyValuePolicy.FALSY);
        Article article = new Article(1, "A", new Article.Author("Ada", "Lovelace"), List.of(), 0);

        assertThat(transformer.transform(article).get("author_s")).isEqualTo("Ada Lovelace");
    }

    @Test
    void requiredNestedPathNamesFailingSegment() {
        IndexerDefinition<Article> definition = articles.extend()
                .attribute("author_s", "author.lastName")
                .build();
        DocumentTransformer<Article> transformer = transformer(definition, EmptyValuePolicy.FALSY);

        assertThatThrownBy(() -> transformer.transform(new Article(1, "A")))
                .isInstanceOf(FieldResolutionException.class)
                .hasMessageContaining("author.lastName")
                .satisfies(e -> assertThat(((FieldResolutionException) e).getSegment()).isEqualTo("author"));
    }

    @Test
    void unknownAccessorFailsOnThatSegment() {
        IndexerDefinition<Article> definition = articles.extend()
                .attribute("author_s", "author.middleName")
                .build();
        DocumentTransformer<Article> transformer = transformer(definition, EmptyValuePolicy.FALSY);
        Article article = new Article(1, "A", new Article.Author("Ada", "Lovelace"), List.of(), 0);

        assertThatThrownBy(() -> transformer.transform(article))
                .isInstanceOf(FieldResolutionException.class)
                .satisfies(e -> assertThat(((FieldResolutionException) e).getSegment()).isEqualTo("middleName"));
    }

    @Test
    void optionalPathThroughPlainValueIsOmitted() {
        IndexerDefinition<Article> definition = articles.extend()
                .optionalAttribute("title_length_i", "title.length")
                .build();
        DocumentTransformer<Article> transformer = transformer(definition, EmptyValuePolicy.FALSY);

        assertThat(transformer.transform(new Article(1, "A")).containsField("title_length_i")).isFalse();
    }

    @Test
    void falsyValuesAreNotWrittenByDefault() {
        IndexerDefinition<Article> definition = articles.extend()
                .attribute("views")
                .attribute("tags")
                .computed("summary", a -> "")
                .build();
        DocumentTransformer<Article> transformer = transformer(definition, EmptyValuePolicy.FALSY);

        IndexDocument document = transformer.transform(new Article(1, "A", null, List.of(), 0));

        assertThat(document.fields()).doesNotContainKeys("views", "tags", "summary");
    }

    @Test
    void nullOnlyPolicyKeepsZeroAndEmptyValues() {
        IndexerDefinition<Article> definition = articles.extend()
                .attribute("views")
                .attribute("tags")
                .computed("summary", a -> "")
                .build();
        DocumentTransformer<Article> transformer = transformer(definition, EmptyValuePolicy.NULL_ONLY);

        IndexDocument document = transformer.transform(new Article(1, "A", null, List.of(), 0));

        assertThat(document.get("views")).isEqualTo(0);
        assertThat(document.get("tags")).isEqualTo(List.of());
        assertThat(document.get("summary")).isEqualTo("");
    }

    @Test
    void computedValueFailureOmitsOptionalFieldAndAbortsRequiredOne() {
        ComputedValue<Article> missing = a -> {
            throw new FieldResolutionException(a, "no summary for " + a.id());
        };
        DocumentTransformer<Article> optional = transformer(
                articles.extend().optionalComputed("summary", missing).build(), EmptyValuePolicy.FALSY);
        DocumentTransformer<Article> required = transformer(
                articles.extend().computed("summary", missing).build(), EmptyValuePolicy.FALSY);

        assertThat(optional.transform(new Article(1, "A")).containsField("summary")).isFalse();
        assertThatThrownBy(() -> required.transform(new Article(1, "A")))
                .isInstanceOf(FieldResolutionException.class)
                .hasMessage("no summary for 1");
    }

    @Test
    void otherExceptionsFromComputedValuesAlwaysPropagate() {
        DocumentTransformer<Article> transformer = transformer(
                articles.extend().optionalComputed("summary", a -> {
                    throw new IllegalStateException("boom");
                }).build(),
                EmptyValuePolicy.FALSY);

        assertThatThrownBy(() -> transformer.transform(new Article(1, "A")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void timestampIsEvaluatedPerRecord() {
        DocumentTransformer<Article> transformer = transformer(articles, EmptyValuePolicy.FALSY);

        Instant first = (Instant) transformer.transform(new Article(1, "A")).get(SystemFields.INDEX_TIMESTAMP);
        Instant second = (Instant) transformer.transform(new Article(2, "B")).get(SystemFields.INDEX_TIMESTAMP);

        assertThat(second).isAfter(first);
    }

    @Test
    void mapRecordsResolveByKey() {
        IndexerDefinition<Map<String, Object>> definition = IndexerDefinition.<Map<String, Object>>builder()
                .type("article")
                .attribute("id")
                .attribute("title")
                .optionalAttribute("author_s", "author.name")
                .build();
        DocumentTransformer<Map<String, Object>> transformer = new DocumentTransformer<>(
                new SchemaBinder(true).bind(definition, schema, clock), "id",
                AttributeResolver.defaults(), EmptyValuePolicy.FALSY);
        Map<String, Object> record = new HashMap<>();
        record.put("id", 1);
        record.put("title", "A");
        record.put("author", Map.of("name", "Ada"));

        IndexDocument document = transformer.transform(record);

        assertThat(document.get("author_s")).isEqualTo("Ada");
        record.put("title", null);
        assertThatThrownBy(() -> transformer.transform(record)).isInstanceOf(FieldResolutionException.class);
    }

    @Test
    void identifyResolvesOnlyTheIdField() {
        IndexerDefinition<Article> definition = articles.extend()
                .attribute("author_s", "author.lastName")
                .build();
        DocumentTransformer<Article> transformer = transformer(definition, EmptyValuePolicy.FALSY);

        assertThat(transformer.identify(new Article(7, null))).isEqualTo(7);
        assertThatThrownBy(() -> transformer.identify(new Article(null, "A")))
                .isInstanceOf(FieldResolutionException.class);
    }

    @Test
    void identifyWithoutIdBindingIsAConfigurationError() {
        IndexerDefinition<Article> definition = IndexerDefinition.<Article>builder()
                .type("article")
                .attribute("title")
                .build();
        DocumentTransformer<Article> transformer = transformer(definition, EmptyValuePolicy.FALSY);

        assertThatThrownBy(() -> transformer.identify(new Article(1, "A")))
                .isInstanceOf(IndexerConfigurationException.class);
    }

    private DocumentTransformer<Article> transformer(IndexerDefinition<Article> definition, EmptyValuePolicy policy) {
        List<FieldBinding<Article>> bindings = new SchemaBinder(true).bind(definition, schema, clock);
        return new DocumentTransformer<>(bindings, definition.idField(), AttributeResolver.defaults(), policy);
    }
}
