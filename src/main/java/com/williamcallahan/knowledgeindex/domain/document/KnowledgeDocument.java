package com.williamcallahan.knowledgeindex.domain.document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A registered source document and its indexing state.
 *
 * <p>The content hash is the only authority on whether the stored bytes changed. The metadata map carries
 * parser output, caller metadata and the settings the document was last indexed with.</p>
 *
 * @param id stable document identifier, reused across re-ingestions
 * @param scopeId container the document belongs to
 * @param path logical path within the scope
 * @param fileName file name used for parser selection
 * @param contentType declared content type, empty when unknown
 * @param contentHash SHA-256 hex digest of the raw bytes, empty before the first hash
 * @param sizeBytes raw content size
 * @param status current lifecycle status
 * @param errorMessage failure message when {@code status} is FAILED, otherwise empty
 * @param createdAt registration time
 * @param updatedAt last modification time
 * @param lastIndexedAt time of the last successful indexing run, null when never indexed
 * @param chunkCount number of chunks produced by the last successful run
 * @param metadata string metadata including indexing provenance
 */
public record KnowledgeDocument(
        String id,
        String scopeId,
        String path,
        String fileName,
        String contentType,
        String contentHash,
        long sizeBytes,
        DocumentStatus status,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt,
        Instant lastIndexedAt,
        int chunkCount,
        Map<String, String> metadata) {

    public KnowledgeDocument {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(scopeId, "scopeId");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        fileName = fileName == null ? "" : fileName;
        contentType = contentType == null ? "" : contentType;
        contentHash = contentHash == null ? "" : contentHash;
        errorMessage = errorMessage == null ? "" : errorMessage;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Creates a freshly registered document awaiting its first ingestion.
     */
    public static KnowledgeDocument pending(
            String id,
            String scopeId,
            String path,
            String fileName,
            String contentType,
            String contentHash,
            long sizeBytes,
            Map<String, String> metadata,
            Instant now) {
        return new KnowledgeDocument(
                id, scopeId, path, fileName, contentType, contentHash, sizeBytes, DocumentStatus.PENDING, "", now, now,
                null, 0, metadata);
    }

    public Optional<Instant> lastIndexed() {
        return Optional.ofNullable(lastIndexedAt);
    }

    public KnowledgeDocument withStatus(DocumentStatus newStatus, String newErrorMessage, Instant now) {
        return new KnowledgeDocument(
                id, scopeId, path, fileName, contentType, contentHash, sizeBytes, newStatus, newErrorMessage,
                createdAt, now, lastIndexedAt, chunkCount, metadata);
    }

    /**
     * Returns a copy registered for another ingestion of new or unchanged bytes.
     */
    public KnowledgeDocument reregistered(
            String newFileName, String newContentType, String newContentHash, long newSizeBytes, Instant now) {
        return new KnowledgeDocument(
                id, scopeId, path, newFileName, newContentType, newContentHash, newSizeBytes, DocumentStatus.PENDING,
                "", createdAt, now, lastIndexedAt, chunkCount, metadata);
    }

    /**
     * Returns a copy queued for reindexing with its previous chunks removed.
     */
    public KnowledgeDocument resetForReindex(Instant now) {
        return new KnowledgeDocument(
                id, scopeId, path, fileName, contentType, contentHash, sizeBytes, DocumentStatus.PENDING, "",
                createdAt, now, lastIndexedAt, 0, metadata);
    }

    /**
     * Returns a copy describing a successful indexing run.
     */
    public KnowledgeDocument indexed(
            String newContentHash, long newSizeBytes, int newChunkCount, Map<String, String> newMetadata, Instant now) {
        return new KnowledgeDocument(
                id, scopeId, path, fileName, contentType, newContentHash, newSizeBytes, DocumentStatus.READY, "",
                createdAt, now, now, newChunkCount, newMetadata);
    }

    /**
     * Returns a copy with the given entries merged over the current metadata.
     */
    public KnowledgeDocument withMergedMetadata(Map<String, String> additions, Instant now) {
        Map<String, String> merged = new LinkedHashMap<>(metadata);
        merged.putAll(additions);
        return new KnowledgeDocument(
                id, scopeId, path, fileName, contentType, contentHash, sizeBytes, status, errorMessage, createdAt,
                now, lastIndexedAt, chunkCount, merged);
    }
}
