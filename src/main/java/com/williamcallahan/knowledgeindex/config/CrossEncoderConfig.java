package com.williamcallahan.knowledgeindex.config;

import com.williamcallahan.knowledgeindex.service.search.CrossEncoderReranker;
import com.williamcallahan.knowledgeindex.service.search.OpenAiRelevanceScorer;
import com.williamcallahan.knowledgeindex.service.search.RelevanceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the cross-encoder reranker when {@code app.cross-encoder.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "app.cross-encoder.enabled", havingValue = "true")
public class CrossEncoderConfig {
    private static final Logger log = LoggerFactory.getLogger(CrossEncoderConfig.class);

    @Bean(destroyMethod = "close")
    public OpenAiRelevanceScorer relevanceScorer(AppProperties appProperties) {
        AppProperties.CrossEncoder crossEncoder = appProperties.getCrossEncoder();
        if (crossEncoder.getBaseUrl().isBlank() || crossEncoder.getApiKey().isBlank()) {
            throw new IllegalStateException(
                    "app.cross-encoder.base-url and app.cross-encoder.api-key must be configured together");
        }
        log.info("[SEARCH] Cross-encoder reranking enabled with model {}", crossEncoder.getModel());
        return OpenAiRelevanceScorer.create(
                crossEncoder.getBaseUrl(), crossEncoder.getApiKey(), crossEncoder.getModel(), crossEncoder.getTemperature());
    }

    @Bean
    public CrossEncoderReranker crossEncoderReranker(RelevanceScorer relevanceScorer) {
        return new CrossEncoderReranker(relevanceScorer);
    }
}
