package com.williamcallahan.knowledgeindex.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.knowledgeindex.domain.document.VectorEntry;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryVectorIndexTest {

    @Test
    void returnsClosestVectorsFirstWithinScope() {
        InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex(2);
        vectorIndex.upsert(List.of(
                entry("near", "d1", "team", "a.txt", 1.0f, 0.1f),
                entry("far", "d2", "team", "b.txt", 0.0f, 1.0f),
                entry("elsewhere", "d3", "other", "c.txt", 1.0f, 0.0f)));

        List<VectorMatch> matches = vectorIndex.search(new float[] {1.0f, 0.0f}, 10, SearchFilter.scope("team"));

        assertEquals(2, matches.size());
        assertEquals("near", matches.get(0).chunkId());
        assertEquals("far", matches.get(1).chunkId());
        assertTrue(matches.get(0).distance() < matches.get(1).distance());
    }

    @Test
    void appliesPathPrefixAndLimit() {
        InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex(2);
        vectorIndex.upsert(List.of(
                entry("r1", "d1", "team", "reports/1.txt", 1.0f, 0.0f),
                entry("r2", "d2", "team", "reports/2.txt", 0.9f, 0.1f),
                entry("x1", "d3", "team", "misc/3.txt", 1.0f, 0.0f)));

        List<VectorMatch> matches =
                vectorIndex.search(new float[] {1.0f, 0.0f}, 1, new SearchFilter("team", "reports/"));

        assertEquals(1, matches.size());
        assertEquals("r1", matches.get(0).chunkId());
    }

    @Test
    void rejectsVectorsOfTheWrongDimension() {
        InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex(3);

        assertThrows(
                IllegalArgumentException.class,
                () -> vectorIndex.upsert(List.of(entry("c", "d", "team", "p", 1.0f, 0.0f))));
        assertEquals(0, vectorIndex.size());
    }

    @Test
    void deleteByDocumentIdRemovesEveryVectorOfTheDocument() {
        InMemoryVectorIndex vectorIndex = new InMemoryVectorIndex(2);
        vectorIndex.upsert(List.of(
                entry("d1#0", "d1", "team", "a.txt", 1.0f, 0.0f),
                entry("d1#1", "d1", "team", "a.txt", 0.0f, 1.0f),
                entry("d2#0", "d2", "team", "b.txt", 1.0f, 1.0f)));

        vectorIndex.deleteByDocumentId("d1");

        assertEquals(0L, vectorIndex.countByDocumentId("d1"));
        assertEquals(1L, vectorIndex.countByDocumentId("d2"));
    }

    private static VectorEntry entry(String chunkId, String documentId, String scopeId, String path, float... vector) {
        return new VectorEntry(chunkId, documentId, scopeId, path, vector, "test-model");
    }
}
