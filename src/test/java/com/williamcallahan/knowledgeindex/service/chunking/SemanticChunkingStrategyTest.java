package com.williamcallahan.knowledgeindex.service.chunking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.knowledgeindex.config.AppProperties;
import com.williamcallahan.knowledgeindex.config.ChunkingSettings;
import com.williamcallahan.knowledgeindex.service.embedding.EmbeddingClient;
import com.williamcallahan.knowledgeindex.service.embedding.EmbeddingServiceUnavailableException;
import com.williamcallahan.knowledgeindex.service.parsing.ParsedDocument;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies topic-shift and budget boundaries of the semantic strategy with a topic-keyed embedding stub.
 */
class SemanticChunkingStrategyTest {

    private static final String TEXT = "Cats purr loudly at night. Cats chase string toys. "
            + "Revenue rose sharply this quarter. Revenue growth beat forecasts.";

    @Test
    void opensNewChunkWhenAdjacentSentencesDiverge() {
        SemanticChunkingStrategy strategy = new SemanticChunkingStrategy(new TopicEmbeddingClient(), new AppProperties());
        ChunkingSettings settings = new ChunkingSettings(SemanticChunkingStrategy.NAME, 512, 0, 1, 0.5);

        List<ChunkDraft> chunks = strategy.chunk(ParsedDocument.of(TEXT), settings);

        assertEquals(2, chunks.size());
        assertEquals("Cats purr loudly at night. Cats chase string toys.", chunks.get(0).content());
        assertEquals("Revenue rose sharply this quarter. Revenue growth beat forecasts.", chunks.get(1).content());
        assertEquals(TEXT.substring(chunks.get(1).startOffset(), chunks.get(1).endOffset()), chunks.get(1).content());
    }

    @Test
    void hardSplitsSentencesLongerThanTheBudget() {
        SemanticChunkingStrategy strategy = new SemanticChunkingStrategy(new TopicEmbeddingClient(), new AppProperties());
        ChunkingSettings settings = new ChunkingSettings(SemanticChunkingStrategy.NAME, 4, 0, 1, 0.5);

        List<ChunkDraft> chunks = strategy.chunk(ParsedDocument.of(TEXT), settings);

        assertTrue(chunks.size() > 4);
        chunks.forEach(chunk -> assertTrue(chunk.content().length() <= TokenEstimator.charsForTokens(4)));
    }

    @Test
    void splitsSentencesOnTerminalPunctuationAndLineBreaks() {
        List<SemanticChunkingStrategy.Span> spans =
                SemanticChunkingStrategy.splitSentences("One. Two!\nThree without stop\n\nFour? 3.5 stays");

        assertEquals(5, spans.size());
    }

    @Test
    void embeddingFailurePropagates() {
        EmbeddingClient failing = new TopicEmbeddingClient() {
            @Override
            public List<float[]> embed(List<String> texts) {
                throw new EmbeddingServiceUnavailableException("offline");
            }
        };
        SemanticChunkingStrategy strategy = new SemanticChunkingStrategy(failing, new AppProperties());
        ChunkingSettings settings = new ChunkingSettings(SemanticChunkingStrategy.NAME, 512, 0, 1, 0.5);

        assertThrows(
                EmbeddingServiceUnavailableException.class,
                () -> strategy.chunk(ParsedDocument.of(TEXT), settings));
    }

    private static class TopicEmbeddingClient implements EmbeddingClient {
        @Override
        public List<float[]> embed(List<String> texts) {
            List<float[]> vectors = new ArrayList<>();
            for (String text : texts) {
                vectors.add(text.startsWith("Cats") ? new float[] {1.0f, 0.0f} : new float[] {0.0f, 1.0f});
            }
            return vectors;
        }

        @Override
        public int dimensions() {
            return 2;
        }

        @Override
        public String modelId() {
            return "topic-stub";
        }
    }
}
