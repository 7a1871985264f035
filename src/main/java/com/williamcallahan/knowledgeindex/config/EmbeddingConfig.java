package com.williamcallahan.knowledgeindex.config;

import com.williamcallahan.knowledgeindex.service.embedding.EmbeddingClient;
import com.williamcallahan.knowledgeindex.service.embedding.EmbeddingServiceUnavailableException;
import com.williamcallahan.knowledgeindex.service.embedding.LocalHashingEmbeddingModel;
import com.williamcallahan.knowledgeindex.service.embedding.OpenAiCompatibleEmbeddingClient;
import com.williamcallahan.knowledgeindex.service.embedding.SpringAiEmbeddingClient;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Embedding provider configuration with strict error propagation.
 *
 * <p>The provider is selected from {@code app.embedding.provider}. No runtime fallback is attempted, so
 * an incomplete provider configuration fails startup instead of indexing with the wrong vectors.</p>
 */
@Configuration
public class EmbeddingConfig {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    static final String PROVIDER_LOCAL_HASH = "local-hash";
    static final String PROVIDER_OPENAI = "openai";
    static final String PROVIDER_SPRING_AI = "spring-ai";

    /**
     * Creates the embedding client for the configured provider.
     *
     * @param appProperties application configuration
     * @param embeddingModels Spring AI embedding model, required only by the {@code spring-ai} provider
     * @return embedding client for the selected provider
     * @throws EmbeddingServiceUnavailableException when the provider is unknown or incompletely configured
     */
    @Bean
    public EmbeddingClient embeddingClient(AppProperties appProperties, ObjectProvider<EmbeddingModel> embeddingModels) {
        AppProperties.Embedding embedding = appProperties.getEmbedding();
        String provider = embedding.getProvider() == null ? "" : embedding.getProvider().trim().toLowerCase(Locale.ROOT);
        switch (provider) {
            case PROVIDER_LOCAL_HASH -> {
                log.info("[EMBEDDING] Using local hashing embeddings ({} dimensions)", embedding.getDimensions());
                return new SpringAiEmbeddingClient(
                        new LocalHashingEmbeddingModel(embedding.getDimensions()),
                        embedding.getModel(),
                        embedding.getDimensions());
            }
            case PROVIDER_OPENAI -> {
                if (embedding.getBaseUrl().isBlank()) {
                    throw new EmbeddingServiceUnavailableException(
                            "app.embedding.base-url is required for the openai embedding provider");
                }
                log.info("[EMBEDDING] Using OpenAI-compatible embeddings at {}", embedding.getBaseUrl());
                return OpenAiCompatibleEmbeddingClient.create(
                        embedding.getBaseUrl(), embedding.getApiKey(), embedding.getModel(), embedding.getDimensions());
            }
            case PROVIDER_SPRING_AI -> {
                EmbeddingModel embeddingModel = embeddingModels.getIfAvailable();
                if (embeddingModel == null) {
                    throw new EmbeddingServiceUnavailableException(
                            "The spring-ai embedding provider requires an EmbeddingModel bean");
                }
                log.info("[EMBEDDING] Using Spring AI embedding model {}", embeddingModel.getClass().getSimpleName());
                return new SpringAiEmbeddingClient(embeddingModel, embedding.getModel(), embedding.getDimensions());
            }
            default -> throw new EmbeddingServiceUnavailableException(
                    "Unknown embedding provider: " + embedding.getProvider());
        }
    }
}
