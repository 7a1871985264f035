package com.williamcallahan.knowledgeindex.service.embedding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.openai.client.OpenAIClient;
import com.openai.core.RequestOptions;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.services.blocking.EmbeddingService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies the OpenAI-compatible adapter orders vectors by response index and validates their shape.
 */
class OpenAiCompatibleEmbeddingClientTest {
    private static final String MODEL = "nomic-embed-text";

    private OpenAIClient client;
    private EmbeddingService embeddingService;

    @BeforeEach
    void setUp() {
        client = mock(OpenAIClient.class);
        embeddingService = mock(EmbeddingService.class);
        when(client.embeddings()).thenReturn(embeddingService);
    }

    @Test
    void returnsVectorsInRequestOrderRegardlessOfResponseOrder() {
        when(embeddingService.create(any(), any(RequestOptions.class)))
                .thenReturn(response(entry(1L, 0.0f, 1.0f), entry(0L, 0.25f, -0.5f)));

        try (OpenAiCompatibleEmbeddingClient adapter = OpenAiCompatibleEmbeddingClient.create(client, MODEL, 2)) {
            List<float[]> vectors = adapter.embed(List.of("first", "second"));

            assertEquals(2, vectors.size());
            assertEquals(0.25f, vectors.get(0)[0]);
            assertEquals(-0.5f, vectors.get(0)[1]);
            assertEquals(0.0f, vectors.get(1)[0]);
            assertEquals(1.0f, vectors.get(1)[1]);
            assertEquals(MODEL, adapter.modelId());
        }
    }

    @Test
    void rejectsVectorsWithUnexpectedDimensions() {
        when(embeddingService.create(any(), any(RequestOptions.class)))
                .thenReturn(response(entry(0L, 0.1f, 0.2f, 0.3f)));

        try (OpenAiCompatibleEmbeddingClient adapter = OpenAiCompatibleEmbeddingClient.create(client, MODEL, 2)) {
            EmbeddingServiceUnavailableException thrown =
                    assertThrows(EmbeddingServiceUnavailableException.class, () -> adapter.embed(List.of("a")));
            assertTrue(thrown.getMessage().contains("dimension mismatch"));
            verify(embeddingService, times(1)).create(any(), any(RequestOptions.class));
        }
    }

    @Test
    void failsWhenAnInputIsMissingFromTheResponse() {
        when(embeddingService.create(any(), any(RequestOptions.class)))
                .thenReturn(response(entry(0L, 0.1f, 0.2f)));

        try (OpenAiCompatibleEmbeddingClient adapter = OpenAiCompatibleEmbeddingClient.create(client, MODEL, 2)) {
            EmbeddingServiceUnavailableException thrown = assertThrows(
                    EmbeddingServiceUnavailableException.class, () -> adapter.embed(List.of("a", "b")));
            assertTrue(thrown.getMessage().contains("index 1"));
        }
    }

    @Test
    void emptyInputSkipsTheRemoteCall() {
        try (OpenAiCompatibleEmbeddingClient adapter = OpenAiCompatibleEmbeddingClient.create(client, MODEL, 2)) {
            assertTrue(adapter.embed(List.of()).isEmpty());
            verify(embeddingService, times(0)).create(any(), any(RequestOptions.class));
        }
    }

    private static CreateEmbeddingResponse response(Embedding... entries) {
        return CreateEmbeddingResponse.builder()
                .model(MODEL)
                .usage(CreateEmbeddingResponse.Usage.builder()
                        .promptTokens(1L)
                        .totalTokens(1L)
                        .build())
                .data(List.of(entries))
                .build();
    }

    private static Embedding entry(long index, Float... values) {
        return Embedding.builder().index(index).embedding(List.of(values)).build();
    }
}
