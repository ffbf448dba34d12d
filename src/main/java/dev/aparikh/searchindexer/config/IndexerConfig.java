package dev.aparikh.searchindexer.config;

import dev.aparikh.searchindexer.indexing.IndexerSettings;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IndexerProperties.class)
class IndexerConfig {

    @Bean
    IndexerSettings indexerSettings(IndexerProperties properties) {
        return properties.toSettings();
    }
}
