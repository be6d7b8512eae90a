package com.zzf.workspace.core.rag.vector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class EmbeddingConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingConfiguration.class);

    @Bean
    public EmbeddingService embeddingService(
            ObjectMapper mapper,
            @Value("${workspace.embedding.provider:hashing}") String provider,
            @Value("${workspace.embedding.api.url:https://api.openai.com/v1}") String baseUrl,
            @Value("${workspace.embedding.api.key:}") String apiKey,
            @Value("${workspace.embedding.api.model:text-embedding-3-small}") String model,
            @Value("${workspace.embedding.api.dimension:256}") int dimension,
            @Value("${workspace.embedding.api.timeout-ms:15000}") int timeoutMs
    ) {
        if (provider == null || !provider.trim().equalsIgnoreCase("openai")) {
            logger.info("embed.provider selected=hashing dims={}", dimension);
            return new HashingEmbeddingService(Math.max(1, dimension));
        }
        if (apiKey == null || apiKey.trim().isEmpty()) {
            logger.info("embed.provider selected=hashing reason=no_api_key dims={}", dimension);
            return new HashingEmbeddingService(Math.max(1, dimension));
        }
        logger.info("embed.provider selected=openai url={} model={} dims={} timeoutMs={}", safeBaseUrl(baseUrl), model, dimension, timeoutMs);
        RemoteEmbeddingService.Endpoint endpoint = RemoteEmbeddingService.Endpoint.builder()
                .baseUri(URI.create(baseUrl))
                .apiKey(apiKey.trim())
                .model(model)
                .dimensions(dimension)
                .timeout(Duration.ofMillis(timeoutMs))
                .build();
        return new RemoteEmbeddingService(HttpClient.newHttpClient(), mapper, endpoint);
    }

    @Bean
    public VectorStore vectorStore() {
        return new InMemoryVectorStore();
    }

    private static String safeBaseUrl(String url) {
        if (url == null) {
            return "";
        }
        int q = url.indexOf('?');
        return q >= 0 ? url.substring(0, q) : url;
    }
}
