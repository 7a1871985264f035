package com.williamcallahan.knowledgeindex.service.chunking;

import com.williamcallahan.knowledgeindex.config.AppProperties;
import com.williamcallahan.knowledgeindex.config.ChunkingSettings;
import com.williamcallahan.knowledgeindex.service.embedding.EmbeddingBatchEmbedder;
import com.williamcallahan.knowledgeindex.service.embedding.EmbeddingClient;
import com.williamcallahan.knowledgeindex.service.embedding.VectorMath;
import com.williamcallahan.knowledgeindex.service.parsing.ParsedDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Groups consecutive sentences into chunks, opening a new chunk where adjacent sentences drift apart.
 *
 * <p>Sentences are embedded in batches. A boundary opens when cosine similarity between neighbours drops
 * below the configured threshold and the current chunk already meets the minimum size, or when the next
 * sentence would push the chunk past the maximum. A single sentence larger than the maximum is hard-split.</p>
 */
@Component
public class SemanticChunkingStrategy implements ChunkingStrategy {

    private static final Logger log = LoggerFactory.getLogger(SemanticChunkingStrategy.class);

    public static final String NAME = "Semantic";

    private final EmbeddingClient embeddingClient;
    private final AppProperties appProperties;

    public SemanticChunkingStrategy(EmbeddingClient embeddingClient, AppProperties appProperties) {
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ChunkDraft> chunk(ParsedDocument document, ChunkingSettings settings) {
        String content = document.content();
        List<Span> sentences = splitSentences(content);
        if (sentences.isEmpty()) {
            return List.of();
        }
        List<String> sentenceTexts = new ArrayList<>(sentences.size());
        for (Span sentence : sentences) {
            sentenceTexts.add(content.substring(sentence.start(), sentence.end()));
        }
        List<float[]> embeddings = sentences.size() == 1
                ? List.of()
                : EmbeddingBatchEmbedder.embedAll(
                        embeddingClient,
                        sentenceTexts,
                        appProperties.getEmbedding().getBatchSize(),
                        1,
                        Runnable::run);
        log.debug("[CHUNKING] Semantic split over {} sentences", sentences.size());

        List<ChunkDraft> chunks = new ArrayList<>();
        int chunkStart = sentences.get(0).start();
        int chunkEnd = sentences.get(0).end();
        for (int index = 1; index < sentences.size(); index++) {
            Span sentence = sentences.get(index);
            int currentTokens = TokenEstimator.estimateTokens(content.substring(chunkStart, chunkEnd));
            int extendedTokens = TokenEstimator.estimateTokens(content.substring(chunkStart, sentence.end()));
            double similarity = VectorMath.cosineSimilarity(embeddings.get(index - 1), embeddings.get(index));

            boolean overBudget = extendedTokens > settings.maxChunkSize();
            boolean topicShift = similarity < settings.semanticThreshold() && currentTokens >= settings.minChunkSize();
            if (overBudget || topicShift) {
                emit(content, chunkStart, chunkEnd, settings, chunks);
                chunkStart = sentence.start();
            }
            chunkEnd = sentence.end();
        }
        emit(content, chunkStart, chunkEnd, settings, chunks);
        return List.copyOf(chunks);
    }

    private static void emit(String content, int start, int end, ChunkingSettings settings, List<ChunkDraft> chunks) {
        int maxChars = TokenEstimator.charsForTokens(settings.maxChunkSize());
        for (int pieceStart = start; pieceStart < end; pieceStart += maxChars) {
            int pieceEnd = Math.min(end, pieceStart + maxChars);
            String text = content.substring(pieceStart, pieceEnd);
            chunks.add(new ChunkDraft(
                    text,
                    chunks.size(),
                    TokenEstimator.estimateTokens(text),
                    pieceStart,
                    pieceEnd,
                    Map.of(METADATA_STRATEGY, NAME)));
        }
    }

    /**
     * Sentence spans ending at terminal punctuation followed by whitespace, or at a line break.
     */
    static List<Span> splitSentences(String content) {
        List<Span> spans = new ArrayList<>();
        int start = 0;
        int length = content.length();
        for (int index = 0; index < length; index++) {
            char character = content.charAt(index);
            boolean terminal = (character == '.' || character == '!' || character == '?')
                    && (index + 1 == length || Character.isWhitespace(content.charAt(index + 1)));
            if (terminal) {
                addTrimmed(content, start, index + 1, spans);
                start = index + 1;
            } else if (character == '\n') {
                addTrimmed(content, start, index, spans);
                start = index + 1;
            }
        }
        addTrimmed(content, start, length, spans);
        return spans;
    }

    private static void addTrimmed(String content, int start, int end, List<Span> spans) {
        int trimmedStart = start;
        int trimmedEnd = end;
        while (trimmedStart < trimmedEnd && Character.isWhitespace(content.charAt(trimmedStart))) {
            trimmedStart++;
        }
        while (trimmedEnd > trimmedStart && Character.isWhitespace(content.charAt(trimmedEnd - 1))) {
            trimmedEnd--;
        }
        if (trimmedEnd > trimmedStart) {
            spans.add(new Span(trimmedStart, trimmedEnd));
        }
    }

    record Span(int start, int end) {}
}
