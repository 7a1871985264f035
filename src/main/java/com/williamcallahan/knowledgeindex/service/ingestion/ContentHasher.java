package com.williamcallahan.knowledgeindex.service.ingestion;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class ContentHasher {

    /**
     * Generates the SHA-256 hex digest of raw document bytes.
     *
     * @param content the bytes to hash
     * @return lowercase hexadecimal digest
     */
    public String sha256(byte[] content) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(content);
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    public String sha256(BufferedContent content) {
        return sha256(content.bytes());
    }

    /**
     * Generates the SHA-256 hex digest of UTF-8 text.
     */
    public String sha256(String text) {
        return sha256(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Builds the stable identifier of a chunk within a document.
     *
     * @param documentId owning document
     * @param chunkIndex chunk ordinal within the document
     * @return chunk identifier reused when the document is re-ingested
     */
    public String chunkId(String documentId, int chunkIndex) {
        return documentId + "#" + chunkIndex;
    }
}
