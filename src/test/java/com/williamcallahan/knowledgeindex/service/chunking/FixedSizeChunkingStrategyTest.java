package com.williamcallahan.knowledgeindex.service.chunking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.knowledgeindex.config.ChunkingSettings;
import com.williamcallahan.knowledgeindex.service.parsing.ParsedDocument;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies window sizing, overlap and break selection of the fixed-size strategy.
 */
class FixedSizeChunkingStrategyTest {

    private final FixedSizeChunkingStrategy strategy = new FixedSizeChunkingStrategy();

    @Test
    void boundaryAtOrBeyondContentLengthReturnsLength() {
        String content = "short text";

        assertEquals(content.length(), FixedSizeChunkingStrategy.findBoundary(content, 0, content.length()));
        assertEquals(content.length(), FixedSizeChunkingStrategy.findBoundary(content, 0, content.length() + 500));
        assertEquals(content.length(), FixedSizeChunkingStrategy.findBoundary(content, 4, Integer.MAX_VALUE));
    }

    @Test
    void boundaryPrefersParagraphBreakOverSentenceBreak() {
        String content = "First sentence. Second one here.\n\nNext paragraph keeps going for a while longer.";
        int paragraphEnd = content.indexOf("\n\n") + 2;

        int boundary = FixedSizeChunkingStrategy.findBoundary(content, 0, paragraphEnd + 3);

        assertEquals(paragraphEnd, boundary);
    }

    @Test
    void boundaryFallsBackToTargetWhenNoBreakIsNearby() {
        String content = "x".repeat(200);

        assertEquals(120, FixedSizeChunkingStrategy.findBoundary(content, 0, 120));
    }

    @Test
    void chunksStayWithinTokenBudgetAndOverlap() {
        String content = String.join(" ", java.util.Collections.nCopies(300, "word"));
        ChunkingSettings settings = new ChunkingSettings(FixedSizeChunkingStrategy.NAME, 50, 10, 1, 0.5);

        List<ChunkDraft> chunks = strategy.chunk(ParsedDocument.of(content), settings);

        assertTrue(chunks.size() >= 5);
        for (int index = 0; index < chunks.size(); index++) {
            ChunkDraft chunk = chunks.get(index);
            assertEquals(index, chunk.index());
            assertTrue(chunk.tokenCount() <= 50, "chunk " + index + " has " + chunk.tokenCount() + " tokens");
            assertEquals(content.substring(chunk.startOffset(), chunk.endOffset()), chunk.content());
            if (index > 0) {
                assertTrue(chunk.startOffset() < chunks.get(index - 1).endOffset(), "consecutive chunks overlap");
            }
        }
        assertEquals(content.length(), chunks.get(chunks.size() - 1).endOffset());
    }

    @Test
    void blankContentYieldsNoChunks() {
        ChunkingSettings settings = new ChunkingSettings(FixedSizeChunkingStrategy.NAME, 50, 10, 1, 0.5);

        assertTrue(strategy.chunk(ParsedDocument.of("   \n  "), settings).isEmpty());
    }

    @Test
    void overlapNotSmallerThanWindowStillAdvances() {
        String content = String.join(" ", java.util.Collections.nCopies(100, "term"));
        ChunkingSettings settings = new ChunkingSettings(FixedSizeChunkingStrategy.NAME, 20, 40, 1, 0.5);

        List<ChunkDraft> chunks = strategy.chunk(ParsedDocument.of(content), settings);

        for (int index = 1; index < chunks.size(); index++) {
            assertTrue(chunks.get(index).startOffset() > chunks.get(index - 1).startOffset());
        }
    }
}
