package com.williamcallahan.knowledgeindex.service.ingestion;

import com.williamcallahan.knowledgeindex.config.AppProperties;
import com.williamcallahan.knowledgeindex.domain.document.DocumentStatus;
import com.williamcallahan.knowledgeindex.domain.document.KnowledgeDocument;
import com.williamcallahan.knowledgeindex.domain.ingestion.EnqueueResult;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJob;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionOptions;
import com.williamcallahan.knowledgeindex.domain.ingestion.UploadOutcome;
import com.williamcallahan.knowledgeindex.store.ContentStoreException;
import com.williamcallahan.knowledgeindex.store.DocumentNotFoundException;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registers uploaded content for background indexing and removes documents with everything derived from them.
 */
@Service
public class DocumentIngestionService {
    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionService.class);
    private static final Logger INDEXING_LOG = LoggerFactory.getLogger("INDEXING");

    private final IngestionStorageServices storage;
    private final IngestionQueue queue;
    private final ContentHasher hasher;
    private final Duration enqueueTimeout;

    public DocumentIngestionService(
            IngestionStorageServices storage, IngestionQueue queue, ContentHasher hasher, AppProperties appProperties) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.enqueueTimeout = appProperties.getIngestion().getEnqueueTimeout();
    }

    /**
     * Stores the bytes and queues an indexing job for them.
     *
     * <p>A path already registered in the scope keeps its document id. Identical bytes that are already
     * indexed are reported as a duplicate and nothing is queued unless a chunking strategy is requested.</p>
     *
     * @param scopeId owning scope
     * @param path logical path; the file name is used when blank
     * @param fileName original file name, used for parser selection
     * @param contentType declared content type, may be empty
     * @param content raw bytes
     * @param chunkingStrategy strategy override, may be empty
     * @param metadata caller metadata merged into the document
     * @return document id, job id and queue outcome
     */
    public UploadOutcome upload(
            String scopeId,
            String path,
            String fileName,
            String contentType,
            byte[] content,
            String chunkingStrategy,
            Map<String, String> metadata) {
        if (scopeId == null || scopeId.isBlank()) {
            throw new IllegalArgumentException("scopeId is required");
        }
        Objects.requireNonNull(content, "content");
        String safeFileName = fileName == null ? "" : fileName.trim();
        String logicalPath = normalizePath(path == null || path.isBlank() ? safeFileName : path);
        if (logicalPath.isEmpty()) {
            throw new IllegalArgumentException("A path or file name is required");
        }
        if (safeFileName.isEmpty()) {
            safeFileName = IngestionPipeline.fileNameOf(logicalPath);
        }

        String contentHash = hasher.sha256(content);
        Optional<KnowledgeDocument> existing = storage.documents().findByScopeAndPath(scopeId, logicalPath);
        boolean strategyRequested = chunkingStrategy != null && !chunkingStrategy.isBlank();
        if (existing.isPresent()
                && !strategyRequested
                && existing.get().status() == DocumentStatus.READY
                && existing.get().contentHash().equals(contentHash)) {
            INDEXING_LOG.info("[INDEXING] Unchanged upload for document {}, nothing queued", existing.get().id());
            return new UploadOutcome(existing.get().id(), "", true, EnqueueResult.ACCEPTED);
        }

        try {
            storage.content().save(scopeId, logicalPath, content);
        } catch (IOException saveFailure) {
            throw new ContentStoreException("Failed to store content for " + logicalPath, saveFailure);
        }

        Instant now = Instant.now();
        String documentId;
        if (existing.isPresent()) {
            KnowledgeDocument reregistered = existing.get()
                    .reregistered(safeFileName, contentType, contentHash, content.length, now)
                    .withMergedMetadata(metadata == null ? Map.of() : metadata, now);
            storage.documents().update(reregistered);
            documentId = reregistered.id();
        } else {
            documentId = UUID.randomUUID().toString();
            storage.documents().insert(KnowledgeDocument.pending(
                    documentId, scopeId, logicalPath, safeFileName, contentType, contentHash, content.length, metadata,
                    now));
        }

        IngestionJob job = IngestionJob.create(
                documentId, logicalPath, new IngestionOptions(scopeId, chunkingStrategy, metadata), "");
        EnqueueResult enqueueResult = queue.enqueue(job, enqueueTimeout);
        if (!enqueueResult.isAccepted()) {
            log.warn("[INDEXING] Document {} registered but not queued: queue full", documentId);
            return new UploadOutcome(documentId, "", false, enqueueResult);
        }
        INDEXING_LOG.info("[INDEXING] Queued document {} as job {}", documentId, job.jobId());
        return new UploadOutcome(documentId, job.jobId(), false, enqueueResult);
    }

    /**
     * Deletes a document with its chunks, vectors, keyword entries and stored bytes.
     *
     * @throws DocumentNotFoundException when no document has the id
     */
    public KnowledgeDocument delete(String documentId) {
        KnowledgeDocument document = require(documentId);
        queue.cancelJobForDocument(documentId);
        int removedChunks = storage.removeIndexData(documentId);
        storage.documents().delete(documentId);
        try {
            storage.content().delete(document.scopeId(), document.path());
        } catch (IOException deleteFailure) {
            log.warn(
                    "[INDEXING] Document {} deleted but its stored content could not be removed: {}",
                    documentId,
                    deleteFailure.getMessage());
        }
        INDEXING_LOG.info("[INDEXING] Deleted document {} ({} chunks)", documentId, removedChunks);
        return document;
    }

    public Optional<KnowledgeDocument> find(String documentId) {
        return storage.documents().findById(documentId);
    }

    public KnowledgeDocument require(String documentId) {
        return storage.documents().findById(documentId).orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    /**
     * Lists documents in a scope, optionally under a path prefix, or every document when the scope is blank.
     */
    public List<KnowledgeDocument> list(String scopeId, String pathPrefix) {
        if (scopeId == null || scopeId.isBlank()) {
            return storage.documents().listAll();
        }
        return storage.documents().listByScope(scopeId, pathPrefix);
    }

    static String normalizePath(String path) {
        String normalized = path.trim().replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }
}
