package com.williamcallahan.knowledgeindex.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher();

    @Test
    void emptyContentHashesToKnownHex() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", hasher.sha256(new byte[0]));
    }

    @Test
    void textBytesAndBufferedContentHashAlike() throws IOException {
        byte[] bytes = "quarterly access review".getBytes(StandardCharsets.UTF_8);
        BufferedContent buffered = BufferedContent.read(new ByteArrayInputStream(bytes));

        String expected = hasher.sha256(bytes);

        assertEquals(expected, hasher.sha256("quarterly access review"));
        assertEquals(expected, hasher.sha256(buffered));
        assertEquals(64, expected.length());
    }

    @Test
    void differentContentHashesDiffer() {
        assertNotEquals(hasher.sha256("a"), hasher.sha256("b"));
    }

    @Test
    void chunkIdCombinesDocumentAndIndex() {
        assertEquals("doc#3", hasher.chunkId("doc", 3));
    }
}
