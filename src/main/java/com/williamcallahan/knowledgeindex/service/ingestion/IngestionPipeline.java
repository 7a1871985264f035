package com.williamcallahan.knowledgeindex.service.ingestion;

import com.google.common.util.concurrent.Striped;
import com.williamcallahan.knowledgeindex.config.AppProperties;
import com.williamcallahan.knowledgeindex.config.ChunkingSettings;
import com.williamcallahan.knowledgeindex.config.EmbeddingSettings;
import com.williamcallahan.knowledgeindex.domain.document.DocumentChunk;
import com.williamcallahan.knowledgeindex.domain.document.DocumentStatus;
import com.williamcallahan.knowledgeindex.domain.document.IndexingProvenance;
import com.williamcallahan.knowledgeindex.domain.document.KnowledgeDocument;
import com.williamcallahan.knowledgeindex.domain.document.VectorEntry;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJob;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionPhase;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionResult;
import com.williamcallahan.knowledgeindex.service.chunking.ChunkDraft;
import com.williamcallahan.knowledgeindex.service.chunking.ChunkingStrategy;
import com.williamcallahan.knowledgeindex.service.chunking.ChunkingStrategyRegistry;
import com.williamcallahan.knowledgeindex.service.embedding.EmbeddingBatchEmbedder;
import com.williamcallahan.knowledgeindex.service.embedding.EmbeddingClient;
import com.williamcallahan.knowledgeindex.service.embedding.EmbeddingServiceUnavailableException;
import com.williamcallahan.knowledgeindex.service.parsing.DocumentParserRegistry;
import com.williamcallahan.knowledgeindex.service.parsing.ParsedDocument;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns one stored document into chunks, vectors and keyword entries, then marks it READY.
 *
 * <p>Runs buffer, hash, parse, chunk, embed and store in order with chunking and embedding settings
 * captured once at the start of the run. Failures are recorded on the document and returned, never
 * thrown. Cancellation is the exception: {@link IngestionCancelledException} propagates to the caller, and
 * while the job still owns its document the partial index data is removed and the document reverts to
 * PENDING. A job superseded by a newer one leaves the document to its successor.</p>
 *
 * <p>Storing and cancellation cleanup for one document are serialized, so a superseded job can never
 * interleave its writes with its successor's.</p>
 */
@Service
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);
    private static final Logger INDEXING_LOG = LoggerFactory.getLogger("INDEXING");

    static final String NO_CONTENT_MESSAGE = "No extractable content";
    private static final int DOCUMENT_LOCK_STRIPES = 64;
    private static final BooleanSupplier ALWAYS_CURRENT = () -> true;

    private final IngestionStorageServices storage;
    private final DocumentParserRegistry parsers;
    private final ChunkingStrategyRegistry chunkingStrategies;
    private final EmbeddingClient embeddingClient;
    private final ContentHasher hasher;
    private final AppProperties appProperties;
    private final Executor embeddingExecutor;
    private final Striped<Lock> documentLocks = Striped.lock(DOCUMENT_LOCK_STRIPES);

    /**
     * Wires the pipeline collaborators.
     *
     * @param storage document, chunk, index and content stores
     * @param parsers parser lookup by file extension
     * @param chunkingStrategies chunking strategy lookup by name
     * @param embeddingClient embedding provider
     * @param hasher content hash helper
     * @param appProperties source of per-run settings snapshots
     * @param embeddingExecutor executor running embedding batches in parallel
     */
    public IngestionPipeline(
            IngestionStorageServices storage,
            DocumentParserRegistry parsers,
            ChunkingStrategyRegistry chunkingStrategies,
            EmbeddingClient embeddingClient,
            ContentHasher hasher,
            AppProperties appProperties,
            @Qualifier("embeddingExecutor") Executor embeddingExecutor) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.parsers = Objects.requireNonNull(parsers, "parsers");
        this.chunkingStrategies = Objects.requireNonNull(chunkingStrategies, "chunkingStrategies");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
        this.embeddingExecutor = Objects.requireNonNull(embeddingExecutor, "embeddingExecutor");
    }

    /**
     * Processes a job, reading the document bytes from the content store.
     *
     * @param job job to process
     * @param cancellation scope checked between phases
     * @param phases receives each phase transition
     * @return outcome of the run
     * @throws IngestionCancelledException when the scope was cancelled during the run
     */
    public IngestionResult process(IngestionJob job, CancellationScope cancellation, IngestionPhaseListener phases) {
        return process(job, null, cancellation, phases, ALWAYS_CURRENT);
    }

    /**
     * Processes a job that may be superseded while it runs.
     *
     * @param currentJob answers whether the job still owns its document; consulted before cancellation cleanup
     */
    public IngestionResult process(
            IngestionJob job, CancellationScope cancellation, IngestionPhaseListener phases, BooleanSupplier currentJob) {
        return process(job, null, cancellation, phases, currentJob);
    }

    /**
     * Processes a job over bytes the caller already holds, or reads them from the content store when
     * {@code preloaded} is null.
     */
    public IngestionResult process(
            IngestionJob job,
            BufferedContent preloaded,
            CancellationScope cancellation,
            IngestionPhaseListener phases,
            BooleanSupplier currentJob) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(cancellation, "cancellation");
        BooleanSupplier ownsDocument = currentJob == null ? ALWAYS_CURRENT : currentJob;
        IngestionPhaseListener phaseListener = phases == null ? IngestionPhaseListener.NONE : phases;
        long startNanos = System.nanoTime();

        ChunkingSettings chunkingSettings =
                ChunkingSettings.from(appProperties).withStrategy(job.options().chunkingStrategy());
        EmbeddingSettings embeddingSettings = EmbeddingSettings.from(appProperties);

        String contentHash = "";
        List<String> warnings = new ArrayList<>();
        try {
            cancellation.throwIfCancelled();
            markProcessing(job);

            phaseListener.onPhase(IngestionPhase.PARSING);
            BufferedContent content = preloaded != null
                    ? preloaded
                    : BufferedContent.read(storage.content().open(job.scopeId(), job.path()));
            contentHash = hasher.sha256(content);
            String fileName = resolveFileName(job);
            ParsedDocument parsed = parsers.parse(content.openStream(), fileName);
            warnings.addAll(parsed.warnings());

            cancellation.throwIfCancelled();
            phaseListener.onPhase(IngestionPhase.CHUNKING);
            ChunkingStrategy strategy = chunkingStrategies.resolve(chunkingSettings.strategy());
            List<ChunkDraft> drafts = parsed.hasContent() ? strategy.chunk(parsed, chunkingSettings) : List.of();
            if (drafts.isEmpty()) {
                String message = warnings.isEmpty()
                        ? NO_CONTENT_MESSAGE
                        : NO_CONTENT_MESSAGE + ": " + String.join("; ", warnings);
                markFailed(job, contentHash, message);
                return new IngestionResult(
                        job.documentId(), false, 0, contentHash, elapsedSince(startNanos), message, warnings);
            }

            cancellation.throwIfCancelled();
            phaseListener.onPhase(IngestionPhase.EMBEDDING);
            List<String> texts = new ArrayList<>(drafts.size());
            for (ChunkDraft draft : drafts) {
                texts.add(draft.content());
            }
            List<float[]> vectors = EmbeddingBatchEmbedder.embedAll(
                    embeddingClient,
                    texts,
                    embeddingSettings.batchSize(),
                    embeddingSettings.parallelBatches(),
                    embeddingExecutor);
            verifyDimensions(vectors, embeddingSettings.dimensions());

            List<DocumentChunk> chunks = toChunks(job, drafts);
            Map<String, String> metadata = new LinkedHashMap<>(parsed.metadata());
            metadata.putAll(job.options().metadata());
            metadata.putAll(IndexingProvenance.describe(chunkingSettings, embeddingSettings));
            Lock documentLock = documentLocks.get(job.documentId());
            documentLock.lock();
            try {
                cancellation.throwIfCancelled();
                phaseListener.onPhase(IngestionPhase.STORING);
                storage.removeIndexData(job.documentId());
                storage.chunks().saveAll(chunks);
                storage.vectors().upsert(toVectorEntries(job, chunks, vectors));
                storage.keywords().index(chunks);
                cancellation.throwIfCancelled();
                upsertIndexedDocument(job, fileName, contentHash, content.size(), chunks.size(), metadata);
            } finally {
                documentLock.unlock();
            }

            phaseListener.onPhase(IngestionPhase.COMPLETE);
            Duration duration = elapsedSince(startNanos);
            INDEXING_LOG.info(
                    "[INDEXING] Indexed document {} ({} chunks, strategy={}) in {} ms",
                    job.documentId(),
                    chunks.size(),
                    strategy.name(),
                    duration.toMillis());
            return new IngestionResult(job.documentId(), true, chunks.size(), contentHash, duration, "", warnings);
        } catch (IngestionCancelledException cancelled) {
            revertCancelled(job, ownsDocument);
            throw cancelled;
        } catch (IOException | RuntimeException failure) {
            if (cancellation.isCancelled()) {
                revertCancelled(job, ownsDocument);
                throw new IngestionCancelledException(cancellation.reason(), failure);
            }
            String message = describeFailure(failure);
            log.warn("[INDEXING] Ingestion of document {} failed: {}", job.documentId(), message);
            markFailed(job, contentHash, message);
            return new IngestionResult(
                    job.documentId(), false, 0, contentHash, elapsedSince(startNanos), message, warnings);
        }
    }

    private void markProcessing(IngestionJob job) {
        storage.documents().findById(job.documentId()).ifPresent(document -> storage.documents()
                .update(document.withStatus(DocumentStatus.PROCESSING, "", Instant.now())));
    }

    private void markFailed(IngestionJob job, String contentHash, String message) {
        try {
            Optional<KnowledgeDocument> existing = storage.documents().findById(job.documentId());
            Instant now = Instant.now();
            if (existing.isPresent()) {
                storage.documents().update(existing.get().withStatus(DocumentStatus.FAILED, message, now));
            } else {
                KnowledgeDocument registered = KnowledgeDocument.pending(
                        job.documentId(), job.scopeId(), job.path(), resolveFileName(job), "", contentHash, 0,
                        job.options().metadata(), now);
                storage.documents().insert(registered.withStatus(DocumentStatus.FAILED, message, now));
            }
        } catch (RuntimeException statusFailure) {
            log.error(
                    "[INDEXING] Could not record failure for document {}: {}",
                    job.documentId(),
                    statusFailure.getMessage());
        }
    }

    private void revertCancelled(IngestionJob job, BooleanSupplier ownsDocument) {
        Lock documentLock = documentLocks.get(job.documentId());
        documentLock.lock();
        try {
            if (!ownsDocument.getAsBoolean()) {
                INDEXING_LOG.info(
                        "[INDEXING] Job {} cancelled after being superseded, document {} left to its successor",
                        job.jobId(),
                        job.documentId());
                return;
            }
            storage.removeIndexData(job.documentId());
            storage.documents().findById(job.documentId()).ifPresent(document -> storage.documents()
                    .update(document.withStatus(DocumentStatus.PENDING, "", Instant.now())));
            INDEXING_LOG.info("[INDEXING] Ingestion of document {} cancelled", job.documentId());
        } catch (RuntimeException cleanupFailure) {
            log.error(
                    "[INDEXING] Cleanup after cancelling document {} failed: {}",
                    job.documentId(),
                    cleanupFailure.getMessage());
        } finally {
            documentLock.unlock();
        }
    }

    /**
     * Updates the document row in place when it exists, otherwise inserts it.
     */
    private void upsertIndexedDocument(
            IngestionJob job, String fileName, String contentHash, long sizeBytes, int chunkCount,
            Map<String, String> indexMetadata) {
        Instant now = Instant.now();
        Optional<KnowledgeDocument> existing = storage.documents().findById(job.documentId());
        if (existing.isPresent()) {
            Map<String, String> metadata = new LinkedHashMap<>(existing.get().metadata());
            metadata.putAll(indexMetadata);
            storage.documents().update(existing.get().indexed(contentHash, sizeBytes, chunkCount, metadata, now));
            return;
        }
        KnowledgeDocument registered = KnowledgeDocument.pending(
                job.documentId(), job.scopeId(), job.path(), fileName, "", contentHash, sizeBytes, Map.of(), now);
        storage.documents().insert(registered.indexed(contentHash, sizeBytes, chunkCount, indexMetadata, now));
    }

    private List<DocumentChunk> toChunks(IngestionJob job, List<ChunkDraft> drafts) {
        List<DocumentChunk> chunks = new ArrayList<>(drafts.size());
        for (ChunkDraft draft : drafts) {
            chunks.add(new DocumentChunk(
                    hasher.chunkId(job.documentId(), draft.index()),
                    job.documentId(),
                    job.scopeId(),
                    job.path(),
                    draft.content(),
                    draft.index(),
                    draft.tokenCount(),
                    draft.startOffset(),
                    draft.endOffset(),
                    draft.metadata()));
        }
        return chunks;
    }

    private List<VectorEntry> toVectorEntries(IngestionJob job, List<DocumentChunk> chunks, List<float[]> vectors) {
        String modelId = embeddingClient.modelId();
        List<VectorEntry> entries = new ArrayList<>(chunks.size());
        for (int index = 0; index < chunks.size(); index++) {
            DocumentChunk chunk = chunks.get(index);
            entries.add(new VectorEntry(
                    chunk.id(), job.documentId(), job.scopeId(), job.path(), vectors.get(index), modelId));
        }
        return entries;
    }

    private static void verifyDimensions(List<float[]> vectors, int expectedDimensions) {
        for (float[] vector : vectors) {
            if (vector == null || vector.length != expectedDimensions) {
                throw new EmbeddingServiceUnavailableException("Embedding dimension mismatch: expected "
                        + expectedDimensions + " but got " + (vector == null ? 0 : vector.length));
            }
        }
    }

    private String resolveFileName(IngestionJob job) {
        return storage.documents()
                .findById(job.documentId())
                .map(KnowledgeDocument::fileName)
                .filter(name -> !name.isBlank())
                .orElseGet(() -> fileNameOf(job.path()));
    }

    static String fileNameOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    private static String describeFailure(Exception failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
