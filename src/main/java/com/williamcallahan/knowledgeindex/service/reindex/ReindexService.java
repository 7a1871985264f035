package com.williamcallahan.knowledgeindex.service.reindex;

import com.williamcallahan.knowledgeindex.config.AppProperties;
import com.williamcallahan.knowledgeindex.config.ChunkingSettings;
import com.williamcallahan.knowledgeindex.config.EmbeddingSettings;
import com.williamcallahan.knowledgeindex.domain.document.DocumentStatus;
import com.williamcallahan.knowledgeindex.domain.document.IndexingProvenance;
import com.williamcallahan.knowledgeindex.domain.document.KnowledgeDocument;
import com.williamcallahan.knowledgeindex.domain.ingestion.EnqueueResult;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJob;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionOptions;
import com.williamcallahan.knowledgeindex.domain.reindex.ReindexAction;
import com.williamcallahan.knowledgeindex.domain.reindex.ReindexCheck;
import com.williamcallahan.knowledgeindex.domain.reindex.ReindexDocumentResult;
import com.williamcallahan.knowledgeindex.domain.reindex.ReindexReason;
import com.williamcallahan.knowledgeindex.domain.reindex.ReindexRequest;
import com.williamcallahan.knowledgeindex.domain.reindex.ReindexResult;
import com.williamcallahan.knowledgeindex.service.ingestion.BufferedContent;
import com.williamcallahan.knowledgeindex.service.ingestion.ContentHasher;
import com.williamcallahan.knowledgeindex.service.ingestion.IngestionQueue;
import com.williamcallahan.knowledgeindex.service.ingestion.IngestionStorageServices;
import com.williamcallahan.knowledgeindex.store.DocumentNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Finds documents whose index no longer matches their bytes or the current settings and re-queues them.
 *
 * <p>Reasons are evaluated in precedence order: forced, content changed, embedding settings changed,
 * chunking settings changed, never indexed. Settings missing from a document's recorded provenance are
 * not treated as changes.</p>
 */
@Service
public class ReindexService {
    private static final Logger log = LoggerFactory.getLogger(ReindexService.class);
    private static final Logger INDEXING_LOG = LoggerFactory.getLogger("INDEXING");

    static final String QUEUE_FULL_MESSAGE = "Ingestion queue is full, index left unchanged";
    static final String QUEUE_FILLED_AFTER_CLEAR_MESSAGE =
            "Ingestion queue is full; index data was already cleared, the next reindex will pick the document"
                    + " up as never indexed";

    private final IngestionStorageServices storage;
    private final IngestionQueue queue;
    private final ContentHasher hasher;
    private final AppProperties appProperties;
    private final Duration enqueueTimeout;

    public ReindexService(
            IngestionStorageServices storage, IngestionQueue queue, ContentHasher hasher, AppProperties appProperties) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
        this.enqueueTimeout = appProperties.getIngestion().getEnqueueTimeout();
    }

    /**
     * Evaluates the selected documents and enqueues those that need reindexing under one batch id.
     */
    public ReindexResult reindex(ReindexRequest request) {
        Objects.requireNonNull(request, "request");
        String batchId = UUID.randomUUID().toString();
        ChunkingSettings chunkingSettings = ChunkingSettings.from(appProperties);
        EmbeddingSettings embeddingSettings = EmbeddingSettings.from(appProperties);

        List<ReindexDocumentResult> results = new ArrayList<>();
        for (String missingId : missingExplicitIds(request)) {
            results.add(new ReindexDocumentResult(
                    missingId, ReindexReason.ERROR, ReindexAction.FAILED, "", "Document not found"));
        }
        for (KnowledgeDocument document : selectTargets(request)) {
            ReindexCheck check = evaluate(
                    document, request.force(), request.detectSettingsChanges(), chunkingSettings, embeddingSettings);
            if (check.needsReindex()) {
                results.add(requeue(document, check, batchId));
            } else {
                ReindexAction action = check.reason() == ReindexReason.ERROR ? ReindexAction.FAILED : ReindexAction.SKIPPED;
                results.add(new ReindexDocumentResult(document.id(), check.reason(), action, "", check.message()));
            }
        }

        ReindexResult result = ReindexResult.summarize(batchId, results);
        INDEXING_LOG.info(
                "[INDEXING] Reindex batch {}: {} evaluated, {} enqueued, {} skipped, {} failed",
                batchId,
                result.totalDocuments(),
                result.enqueuedCount(),
                result.skippedCount(),
                result.failedCount());
        return result;
    }

    /**
     * Evaluates one document against the current settings without enqueueing anything.
     *
     * @throws DocumentNotFoundException when no document has the id
     */
    public ReindexCheck checkDocument(String documentId) {
        KnowledgeDocument document =
                storage.documents().findById(documentId).orElseThrow(() -> new DocumentNotFoundException(documentId));
        return evaluate(
                document, false, true, ChunkingSettings.from(appProperties), EmbeddingSettings.from(appProperties));
    }

    ReindexCheck evaluate(
            KnowledgeDocument document,
            boolean force,
            boolean detectSettingsChanges,
            ChunkingSettings chunkingSettings,
            EmbeddingSettings embeddingSettings) {
        if (force) {
            return new ReindexCheck(document.id(), ReindexReason.FORCED, "");
        }

        String currentHash;
        try {
            BufferedContent content = BufferedContent.read(storage.content().open(document.scopeId(), document.path()));
            currentHash = hasher.sha256(content);
        } catch (NoSuchFileException missing) {
            return new ReindexCheck(document.id(), ReindexReason.FILE_NOT_FOUND, "Stored content not found");
        } catch (IOException | RuntimeException readFailure) {
            log.warn("[INDEXING] Could not read content of document {}: {}", document.id(), readFailure.getMessage());
            return new ReindexCheck(document.id(), ReindexReason.ERROR, readFailure.getMessage());
        }

        if (!currentHash.equals(document.contentHash())) {
            return new ReindexCheck(document.id(), ReindexReason.CONTENT_CHANGED, "");
        }
        if (detectSettingsChanges) {
            Map<String, String> metadata = document.metadata();
            Optional<String> recordedEmbedding = IndexingProvenance.recordedEmbeddingKey(metadata);
            if (recordedEmbedding.isPresent() && !recordedEmbedding.get().equals(embeddingSettings.settingsKey())) {
                return new ReindexCheck(
                        document.id(),
                        ReindexReason.EMBEDDING_SETTINGS_CHANGED,
                        recordedEmbedding.get() + " -> " + embeddingSettings.settingsKey());
            }
            Optional<String> recordedChunking = IndexingProvenance.recordedChunkingKey(metadata);
            if (recordedChunking.isPresent() && !recordedChunking.get().equals(chunkingSettings.settingsKey())) {
                return new ReindexCheck(
                        document.id(),
                        ReindexReason.CHUNKING_SETTINGS_CHANGED,
                        recordedChunking.get() + " -> " + chunkingSettings.settingsKey());
            }
        }
        if (document.status() != DocumentStatus.READY || document.lastIndexed().isEmpty()) {
            return new ReindexCheck(document.id(), ReindexReason.NEVER_INDEXED, "");
        }
        return new ReindexCheck(document.id(), ReindexReason.UNCHANGED, "");
    }

    /**
     * Clears the document's index data and queues it again. A queue with no room is detected before
     * anything is cleared; if the queue fills up in between, the document stays cleared and PENDING and the
     * next reindex run picks it up as never indexed.
     */
    private ReindexDocumentResult requeue(KnowledgeDocument document, ReindexCheck check, String batchId) {
        if (queue.remainingCapacity() == 0) {
            return new ReindexDocumentResult(
                    document.id(), check.reason(), ReindexAction.FAILED, "", QUEUE_FULL_MESSAGE);
        }
        try {
            storage.removeIndexData(document.id());
            storage.documents().update(document.resetForReindex(Instant.now()));
            IngestionJob job = IngestionJob.create(
                    document.id(), document.path(), IngestionOptions.forScope(document.scopeId()), batchId);
            EnqueueResult enqueueResult = queue.enqueue(job, enqueueTimeout);
            if (!enqueueResult.isAccepted()) {
                log.warn("[INDEXING] Queue filled up while requeueing document {}, left PENDING", document.id());
                return new ReindexDocumentResult(
                        document.id(), check.reason(), ReindexAction.FAILED, "", QUEUE_FILLED_AFTER_CLEAR_MESSAGE);
            }
            return new ReindexDocumentResult(document.id(), check.reason(), ReindexAction.ENQUEUED, job.jobId(), "");
        } catch (RuntimeException requeueFailure) {
            log.warn("[INDEXING] Could not requeue document {}: {}", document.id(), requeueFailure.getMessage());
            return new ReindexDocumentResult(
                    document.id(), check.reason(), ReindexAction.FAILED, "", requeueFailure.getMessage());
        }
    }

    private List<KnowledgeDocument> selectTargets(ReindexRequest request) {
        if (!request.documentIds().isEmpty()) {
            List<KnowledgeDocument> documents = new ArrayList<>();
            for (String documentId : request.documentIds()) {
                storage.documents().findById(documentId).ifPresent(documents::add);
            }
            return documents;
        }
        if (!request.scopeId().isBlank()) {
            return storage.documents().listByScope(request.scopeId(), request.pathPrefix());
        }
        return storage.documents().listAll();
    }

    private List<String> missingExplicitIds(ReindexRequest request) {
        List<String> missing = new ArrayList<>();
        for (String documentId : request.documentIds()) {
            if (storage.documents().findById(documentId).isEmpty()) {
                missing.add(documentId);
            }
        }
        return missing;
    }
}
