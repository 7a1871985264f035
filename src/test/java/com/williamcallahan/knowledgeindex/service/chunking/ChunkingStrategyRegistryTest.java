package com.williamcallahan.knowledgeindex.service.chunking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkingStrategyRegistryTest {

    private final RecursiveChunkingStrategy recursive = new RecursiveChunkingStrategy();
    private final ChunkingStrategyRegistry registry = new ChunkingStrategyRegistry(List.of(recursive));

    @Test
    void resolvesStrategiesIgnoringCase() {
        assertSame(recursive, registry.resolve("recursive"));
        assertSame(recursive, registry.resolve(" RECURSIVE "));
    }

    @Test
    void unknownOrMissingNamesFallBackToFixedSize() {
        assertEquals(FixedSizeChunkingStrategy.NAME, registry.resolve("Paragraphs").name());
        assertEquals(FixedSizeChunkingStrategy.NAME, registry.resolve(null).name());
    }
}
