package com.williamcallahan.knowledgeindex.service.chunking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.knowledgeindex.config.ChunkingSettings;
import com.williamcallahan.knowledgeindex.service.parsing.ParsedDocument;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecursiveChunkingStrategyTest {

    private final RecursiveChunkingStrategy strategy = new RecursiveChunkingStrategy();

    @Test
    void clampOffsetKeepsSearchPositionInsideContent() {
        assertEquals(10, RecursiveChunkingStrategy.clampOffset(25, 10));
        assertEquals(0, RecursiveChunkingStrategy.clampOffset(-3, 10));
        assertEquals(4, RecursiveChunkingStrategy.clampOffset(4, 10));
    }

    @Test
    void splitsOnParagraphsAndRecordsTrueOffsets() {
        String paragraph = "Sentence about the topic at hand. ".repeat(5).trim();
        String content = paragraph + "\n\n" + paragraph.replace("topic", "theme") + "\n\n"
                + paragraph.replace("topic", "issue");
        ChunkingSettings settings = new ChunkingSettings(RecursiveChunkingStrategy.NAME, 60, 10, 1, 0.5);

        List<ChunkDraft> chunks = strategy.chunk(ParsedDocument.of(content), settings);

        assertTrue(chunks.size() >= 3);
        for (ChunkDraft chunk : chunks) {
            assertEquals(content.substring(chunk.startOffset(), chunk.endOffset()), chunk.content());
            assertTrue(chunk.content().length() <= TokenEstimator.charsForTokens(60));
        }
    }

    @Test
    void unbrokenTextIsHardSplitWithinBudget() {
        String content = "a".repeat(1_000);
        ChunkingSettings settings = new ChunkingSettings(RecursiveChunkingStrategy.NAME, 50, 0, 1, 0.5);

        List<ChunkDraft> chunks = strategy.chunk(ParsedDocument.of(content), settings);

        assertEquals(5, chunks.size());
        assertEquals(content.length(), chunks.get(chunks.size() - 1).endOffset());
        chunks.forEach(chunk -> assertTrue(chunk.tokenCount() <= 50));
    }

    @Test
    void trailingSeparatorsDoNotPushOffsetsPastTheEnd() {
        String content = "alpha beta gamma. ".repeat(40) + "\n\n\n\n";
        ChunkingSettings settings = new ChunkingSettings(RecursiveChunkingStrategy.NAME, 20, 5, 1, 0.5);

        List<ChunkDraft> chunks = strategy.chunk(ParsedDocument.of(content), settings);

        assertTrue(chunks.size() > 1);
        chunks.forEach(chunk -> assertTrue(chunk.endOffset() <= content.length()));
    }
}
