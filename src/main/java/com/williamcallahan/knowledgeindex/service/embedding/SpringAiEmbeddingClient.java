package com.williamcallahan.knowledgeindex.service.embedding;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Adapts a Spring AI {@link EmbeddingModel} to the {@link EmbeddingClient} port.
 *
 * <p>Validates result count and dimensionality so a misconfigured model surfaces as an
 * {@link EmbeddingServiceUnavailableException} rather than as vectors the index cannot accept.</p>
 */
public class SpringAiEmbeddingClient implements EmbeddingClient {
    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingClient.class);

    private final EmbeddingModel embeddingModel;
    private final String modelId;
    private final int dimensions;

    public SpringAiEmbeddingClient(EmbeddingModel embeddingModel, String modelId, int dimensions) {
        this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel");
        this.modelId = Objects.requireNonNull(modelId, "modelId");
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<float[]> vectors;
        try {
            vectors = embeddingModel.embed(texts);
        } catch (RuntimeException providerFailure) {
            log.warn("[EMBEDDING] Provider call failed for {} texts (exceptionType={})",
                    texts.size(), providerFailure.getClass().getSimpleName());
            throw new EmbeddingServiceUnavailableException(
                    "Embedding provider failed: " + providerFailure.getMessage(), providerFailure);
        }
        if (vectors == null || vectors.size() != texts.size()) {
            throw new EmbeddingServiceUnavailableException("Embedding response count mismatch: expected "
                    + texts.size() + " but received " + (vectors == null ? 0 : vectors.size()));
        }
        for (int index = 0; index < vectors.size(); index++) {
            float[] vector = vectors.get(index);
            if (vector == null || vector.length != dimensions) {
                throw new EmbeddingServiceUnavailableException("Embedding dimension mismatch at index " + index
                        + ": expected " + dimensions + " but received " + (vector == null ? 0 : vector.length));
            }
        }
        return List.copyOf(vectors);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelId() {
        return modelId;
    }
}
