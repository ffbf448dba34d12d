package dev.aparikh.searchindexer.reindex;

import dev.aparikh.searchindexer.indexing.BatchIndexer;
import dev.aparikh.searchindexer.indexing.IndexBackend;
import dev.aparikh.searchindexer.indexing.IndexerConfigurationException;
import dev.aparikh.searchindexer.indexing.IndexerSettings;
import dev.aparikh.searchindexer.indexing.ReconcilingReindexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs reindex passes for the registered indexer types, at most one per type at a time.
 *
 * <p>Each pass builds a fresh {@link BatchIndexer}, so field bindings are resolved against the schema
 * as it is when the pass starts.
 */
@Service
public class IndexerService {

    private static final Logger log = LoggerFactory.getLogger(IndexerService.class);

    private final IndexBackend backend;
    private final IndexerSettings settings;
    private final Map<String, IndexerRegistration<?>> registrations;
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    @Autowired
    public IndexerService(IndexBackend backend,
                          IndexerSettings settings,
                          ObjectProvider<IndexerRegistration<?>> registrations) {
        this(backend, settings, registrations.orderedStream().toList());
    }

    IndexerService(IndexBackend backend, IndexerSettings settings, Collection<IndexerRegistration<?>> registrations) {
        this.backend = backend;
        this.settings = settings;
        this.registrations = new LinkedHashMap<>();
        for (IndexerRegistration<?> registration : registrations) {
            if (this.registrations.putIfAbsent(registration.type(), registration) != null) {
                throw new IndexerConfigurationException("Indexer type '" + registration.type() + "' is registered twice");
            }
        }
        log.info("Registered indexer types: {}", this.registrations.keySet());
    }

    public List<String> types() {
        return List.copyOf(registrations.keySet());
    }

    /**
     * @throws UnknownIndexerException     when no indexer is registered for {@code type}
     * @throws ReindexInProgressException  when a pass for {@code type} is already running
     */
    public ReindexResult reindex(String type) {
        IndexerRegistration<?> registration = registrations.get(type);
        if (registration == null) {
            throw new UnknownIndexerException(type);
        }
        if (!running.add(type)) {
            throw new ReindexInProgressException(type);
        }
        try {
            return run(registration);
        } catch (RuntimeException e) {
            log.error("Reindex of '{}' failed", type, e);
            throw e;
        } finally {
            running.remove(type);
        }
    }

    private <R> ReindexResult run(IndexerRegistration<R> registration) {
        BatchIndexer<R> indexer = new BatchIndexer<>(backend, registration.definition(), settings);
        ReconcilingReindexer<R> reindexer = new ReconcilingReindexer<>(indexer, registration.source());
        long indexed = reindexer.reindex();
        return new ReindexResult(registration.type(), indexed, reindexer.run().startedAt(), settings.clock().instant());
    }
}
