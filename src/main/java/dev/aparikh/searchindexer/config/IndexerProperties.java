package dev.aparikh.searchindexer.config;

import dev.aparikh.searchindexer.indexing.EmptyValuePolicy;
import dev.aparikh.searchindexer.indexing.IndexerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Defaults applied to every indexer the application runs.
 */
@Validated
@ConfigurationProperties(prefix = "indexer")
class IndexerProperties {

    @Positive
    private int commitChunkSize = IndexerSettings.DEFAULT_COMMIT_CHUNK_SIZE;

    private boolean validateSchema = true;

    @NotNull
    private EmptyValuePolicy emptyValuePolicy = EmptyValuePolicy.FALSY;

    IndexerSettings toSettings() {
        return IndexerSettings.defaults()
                .withCommitChunkSize(commitChunkSize)
                .withValidateSchema(validateSchema)
                .withEmptyValuePolicy(emptyValuePolicy);
    }

    int getCommitChunkSize() {
        return commitChunkSize;
    }

    void setCommitChunkSize(int commitChunkSize) {
        this.commitChunkSize = commitChunkSize;
    }

    boolean isValidateSchema() {
        return validateSchema;
    }

    void setValidateSchema(boolean validateSchema) {
        this.validateSchema = validateSchema;
    }

    EmptyValuePolicy getEmptyValuePolicy() {
        return emptyValuePolicy;
    }

    void setEmptyValuePolicy(EmptyValuePolicy emptyValuePolicy) {
        this.emptyValuePolicy = emptyValuePolicy;
    }
}
