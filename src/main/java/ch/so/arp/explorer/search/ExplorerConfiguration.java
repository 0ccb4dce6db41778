package ch.so.arp.explorer.search;

import java.time.Clock;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Central configuration wiring the search components together. A toggle
 * decides whether deterministic or model server embeddings are used.
 */
@Configuration
@EnableConfigurationProperties({ CatalogProperties.class, EmbeddingClientProperties.class })
public class ExplorerConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "explorer.embedding.mock", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(EmbeddingClientProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "explorer.embedding.mock", havingValue = "false")
    public EmbeddingProvider remoteEmbeddingProvider(ObjectProvider<RestClient.Builder> restClientBuilder,
            EmbeddingClientProperties properties) {
        return new RemoteEmbeddingProvider(restClientBuilder.getIfAvailable(RestClient::builder), properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ItemCatalog itemCatalog(CatalogProperties properties, EmbeddingProvider embeddingProvider,
            ObjectProvider<ObjectMapper> objectMapper) {
        CatalogFeedReader feedReader = new CatalogFeedReader(objectMapper.getIfAvailable(ObjectMapper::new));
        return new CatalogLoader(feedReader, embeddingProvider).load(properties.getFeedPath(),
                properties.getCachePath());
    }

    @Bean
    @ConditionalOnMissingBean
    public SimilarityRanker similarityRanker() {
        return new SimilarityRanker();
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoryStore historyStore(ItemCatalog itemCatalog, Clock clock) {
        return new HistoryStore(itemCatalog, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchService searchService(EmbeddingProvider embeddingProvider, ItemCatalog itemCatalog,
            SimilarityRanker similarityRanker, HistoryStore historyStore) {
        return new SearchService(embeddingProvider, itemCatalog, similarityRanker, historyStore);
    }

    @Bean
    public WebMvcConfigurer corsConfigurer() {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/api/**").allowedOrigins("*").allowedMethods("*").allowedHeaders("*");
            }
        };
    }
}
