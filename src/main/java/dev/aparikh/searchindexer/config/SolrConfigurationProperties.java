package dev.aparikh.searchindexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Typed configuration properties for the Solr connection.
 */
@Validated
@ConfigurationProperties(prefix = "solr")
class SolrConfigurationProperties {

    @NotBlank
    private String baseUrl;

    @NotBlank
    private String core;

    @Positive
    private int connectionTimeoutMs = 10_000;

    @Positive
    private int socketTimeoutMs = 120_000; // reindex chunks can take a while to apply

    String getBaseUrl() {
        return baseUrl;
    }

    void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    String getCore() {
        return core;
    }

    void setCore(String core) {
        this.core = core;
    }

    int getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    void setConnectionTimeoutMs(int connectionTimeoutMs) {
        this.connectionTimeoutMs = connectionTimeoutMs;
    }

    int getSocketTimeoutMs() {
        return socketTimeoutMs;
    }

    void setSocketTimeoutMs(int socketTimeoutMs) {
        this.socketTimeoutMs = socketTimeoutMs;
    }
}
