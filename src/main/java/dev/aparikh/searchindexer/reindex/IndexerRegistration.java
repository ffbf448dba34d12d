package dev.aparikh.searchindexer.reindex;

import dev.aparikh.searchindexer.indexing.IndexerDefinition;
import dev.aparikh.searchindexer.indexing.RecordSource;

import java.util.Objects;

/**
 * An indexer type the application can reindex on demand. Declare one as a bean per type:
 *
 * <pre>{@code
 * @Bean
 * IndexerRegistration<Article> articles(ArticleRepository repository) {
 *     return new IndexerRegistration<>(ARTICLE_DEFINITION, repository::streamAll);
 * }
 * }</pre>
 */
public record IndexerRegistration<R>(IndexerDefinition<R> definition, RecordSource<? extends R> source) {

    public IndexerRegistration {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(source, "source");
    }

    public String type() {
        return definition.typeTag();
    }
}
