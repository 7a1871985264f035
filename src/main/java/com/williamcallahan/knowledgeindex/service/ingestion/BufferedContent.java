package com.williamcallahan.knowledgeindex.service.ingestion;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Fully buffered document bytes, so the source is read once and then hashed and parsed independently.
 */
public final class BufferedContent {

    private final byte[] bytes;

    private BufferedContent(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Reads the stream to its end and closes it.
     */
    public static BufferedContent read(InputStream input) throws IOException {
        Objects.requireNonNull(input, "input");
        try (InputStream source = input) {
            return new BufferedContent(source.readAllBytes());
        }
    }

    public static BufferedContent of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new BufferedContent(bytes.clone());
    }

    /**
     * Opens a fresh stream over the buffered bytes. Each call starts at the beginning.
     */
    public InputStream openStream() {
        return new ByteArrayInputStream(bytes);
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public long size() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }
}
