package dev.aparikh.searchindexer.reindex;

import dev.aparikh.searchindexer.indexing.FieldMetadata;
import dev.aparikh.searchindexer.indexing.FieldResolutionException;
import dev.aparikh.searchindexer.indexing.IndexBackend;
import dev.aparikh.searchindexer.indexing.IndexDocument;
import dev.aparikh.searchindexer.indexing.IndexQuery;
import dev.aparikh.searchindexer.indexing.IndexerConfigurationException;
import dev.aparikh.searchindexer.indexing.IndexerDefinition;
import dev.aparikh.searchindexer.indexing.IndexerSettings;
import dev.aparikh.searchindexer.indexing.RecordSource;
import dev.aparikh.searchindexer.indexing.SystemFields;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IndexerServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");

    private static final IndexerDefinition<Map<String, Object>> ARTICLES = IndexerDefinition.<Map<String, Object>>builder()
            .type("article")
            .attribute("id")
            .attribute("title")
            .build();

    @Mock
    private IndexBackend backend;

    private final IndexerSettings settings = IndexerSettings.defaults()
            .withClock(Clock.fixed(NOW, ZoneOffset.UTC));

    @BeforeEach
    void setUp() {
        lenient().when(backend.schema()).thenReturn(name ->
                name.equals("id") || name.equals("title") || SystemFields.TYPE.equals(name)
                        || SystemFields.INDEX_TIMESTAMP.equals(name)
                        ? Optional.of(FieldMetadata.declared(name))
                        : Optional.empty());
    }

    @Test
    void typesListsRegistrationsInOrder() {
        IndexerService service = service(
                new IndexerRegistration<>(ARTICLES, Stream::empty),
                new IndexerRegistration<>(ARTICLES.extend().type("news").build(), Stream::empty));

        assertThat(service.types()).containsExactly("article", "news");
    }

    @Test
    void duplicateTypeIsRejected() {
        assertThatThrownBy(() -> service(
                new IndexerRegistration<>(ARTICLES, Stream::empty),
                new IndexerRegistration<>(ARTICLES, Stream::empty)))
                .isInstanceOf(IndexerConfigurationException.class)
                .hasMessageContaining("'article'");
    }

    @Test
    void reindexStreamsCommitsThenDeletesStaleDocuments() {
        RecordSource<Map<String, Object>> source = () -> Stream.of(
                Map.of("id", 1, "title", "A"),
                Map.of("id", 2, "title", "B"));
        IndexerService service = service(new IndexerRegistration<>(ARTICLES, source));

        ReindexResult result = service.reindex("article");

        assertThat(result.type()).isEqualTo("article");
        assertThat(result.indexed()).isEqualTo(2);
        assertThat(result.startedAt()).isEqualTo(NOW);

        ArgumentCaptor<List<IndexDocument>> added = ArgumentCaptor.forClass(List.class);
        InOrder order = inOrder(backend);
        order.verify(backend).add(added.capture());
        order.verify(backend).commit();
        order.verify(backend).deleteByQuery(IndexQuery.eq(SystemFields.TYPE, "article")
                .and(IndexQuery.lt(SystemFields.INDEX_TIMESTAMP, NOW)));
        assertThat(added.getValue()).hasSize(2);
    }

    @Test
    void unknownTypeIsRejected() {
        IndexerService service = service(new IndexerRegistration<>(ARTICLES, Stream::empty));

        assertThatThrownBy(() -> service.reindex("podcast"))
                .isInstanceOf(UnknownIndexerException.class)
                .hasMessageContaining("'podcast'");
        verifyNoInteractions(backend);
    }

    @Test
    void overlappingReindexOfSameTypeIsRejected() {
        IndexerService[] holder = new IndexerService[1];
        RecordSource<Map<String, Object>> reentrant = () -> {
            holder[0].reindex("article");
            return Stream.empty();
        };
        holder[0] = service(new IndexerRegistration<>(ARTICLES, reentrant));

        assertThatThrownBy(() -> holder[0].reindex("article"))
                .isInstanceOf(ReindexInProgressException.class);
        verify(backend, never()).commit();
        verify(backend, never()).deleteByQuery(any());
    }

    @Test
    void failedPassReleasesTheType() {
        RecordSource<Map<String, Object>> broken = () -> Stream.of(Map.of("id", 1));
        IndexerService service = service(new IndexerRegistration<>(ARTICLES, broken));

        assertThatThrownBy(() -> service.reindex("article")).isInstanceOf(FieldResolutionException.class);
        assertThatThrownBy(() -> service.reindex("article")).isInstanceOf(FieldResolutionException.class);

        verify(backend, never()).add(anyList());
        verify(backend, never()).commit();
    }

    @SafeVarargs
    private IndexerService service(IndexerRegistration<Map<String, Object>>... registrations) {
        return new IndexerService(backend, settings, List.<IndexerRegistration<?>>of(registrations));
    }
}
