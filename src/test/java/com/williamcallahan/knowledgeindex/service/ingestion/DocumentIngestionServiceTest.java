package com.williamcallahan.knowledgeindex.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.knowledgeindex.IndexingFixture;
import com.williamcallahan.knowledgeindex.config.AppProperties;
import com.williamcallahan.knowledgeindex.domain.document.DocumentStatus;
import com.williamcallahan.knowledgeindex.domain.document.KnowledgeDocument;
import com.williamcallahan.knowledgeindex.domain.ingestion.EnqueueResult;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobState;
import com.williamcallahan.knowledgeindex.domain.ingestion.UploadOutcome;
import com.williamcallahan.knowledgeindex.domain.search.SearchMode;
import com.williamcallahan.knowledgeindex.domain.search.SearchRequest;
import com.williamcallahan.knowledgeindex.store.DocumentNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentIngestionServiceTest {

    private static final String RUNBOOK = "Rotate the signing keys every ninety days and record the rotation.";

    @TempDir
    Path contentRoot;

    private IndexingFixture fixture;

    @AfterEach
    void tearDown() throws IOException {
        if (fixture != null) {
            fixture.close();
        }
    }

    @Test
    void uploadRegistersPendingDocumentAndQueuesJob() {
        fixture = new IndexingFixture(contentRoot);

        UploadOutcome outcome = fixture.upload("ops/runbook.txt", RUNBOOK);

        assertEquals(EnqueueResult.ACCEPTED, outcome.enqueueResult());
        assertFalse(outcome.duplicate());
        assertFalse(outcome.jobId().isEmpty());
        KnowledgeDocument document = fixture.documents.require(outcome.documentId());
        assertEquals(DocumentStatus.PENDING, document.status());
        assertEquals("ops/runbook.txt", document.path());
        assertEquals("runbook.txt", document.fileName());
        assertEquals(IndexingFixture.SCOPE, document.scopeId());
        assertEquals(IngestionJobState.QUEUED, fixture.queue.getStatus(outcome.jobId()).orElseThrow().state());
    }

    @Test
    void identicalReuploadOfIndexedDocumentIsDuplicate() {
        fixture = new IndexingFixture(contentRoot);
        String documentId = fixture.ingest("ops/runbook.txt", RUNBOOK);

        UploadOutcome again = fixture.upload("ops/runbook.txt", RUNBOOK);

        assertTrue(again.duplicate());
        assertEquals(documentId, again.documentId());
        assertEquals("", again.jobId());
        assertEquals(0, fixture.queue.queueDepth());
    }

    @Test
    void changedBytesKeepTheDocumentId() {
        fixture = new IndexingFixture(contentRoot);
        String documentId = fixture.ingest("ops/runbook.txt", RUNBOOK);
        String originalHash = fixture.documents.require(documentId).contentHash();

        UploadOutcome changed = fixture.upload("/ops/runbook.txt", RUNBOOK + " Notify the on-call lead.");

        assertFalse(changed.duplicate());
        assertEquals(documentId, changed.documentId());
        assertNotEquals(originalHash, fixture.documents.require(documentId).contentHash());
        assertEquals(1, fixture.documents.list(IndexingFixture.SCOPE, "").size());
    }

    @Test
    void uploadWithoutScopeIsRejected() {
        fixture = new IndexingFixture(contentRoot);
        byte[] bytes = RUNBOOK.getBytes(StandardCharsets.UTF_8);

        assertThrows(
                IllegalArgumentException.class,
                () -> fixture.documents.upload(" ", "a.txt", "a.txt", "text/plain", bytes, null, Map.of()));
    }

    @Test
    void fullQueueRegistersDocumentButReportsQueueFull() {
        AppProperties properties = IndexingFixture.defaultProperties();
        properties.getIngestion().setQueueCapacity(1);
        fixture = new IndexingFixture(contentRoot, properties);
        fixture.upload("first.txt", "first document");

        UploadOutcome rejected = fixture.upload("second.txt", "second document");

        assertEquals(EnqueueResult.QUEUE_FULL, rejected.enqueueResult());
        assertEquals("", rejected.jobId());
        assertEquals(DocumentStatus.PENDING, fixture.documents.require(rejected.documentId()).status());
    }

    @Test
    void deleteRemovesEverythingIndexedForTheDocument() {
        fixture = new IndexingFixture(contentRoot);
        String documentId = fixture.ingest("ops/runbook.txt", RUNBOOK);
        assertFalse(fixture.search.search(keywordQuery("signing keys")).hits().isEmpty());

        KnowledgeDocument deleted = fixture.documents.delete(documentId);

        assertEquals(documentId, deleted.id());
        assertTrue(fixture.documents.find(documentId).isEmpty());
        assertEquals(0, fixture.storage.chunks().countByDocumentId(documentId));
        assertEquals(0L, fixture.vectorIndex.countByDocumentId(documentId));
        assertEquals(0L, fixture.keywordIndex.countByDocumentId(documentId));
        assertTrue(fixture.search.search(keywordQuery("signing keys")).hits().isEmpty());
        assertThrows(
                NoSuchFileException.class,
                () -> fixture.storage.content().open(IndexingFixture.SCOPE, "ops/runbook.txt").close());
    }

    @Test
    void deleteCancelsQueuedJob() {
        fixture = new IndexingFixture(contentRoot);
        UploadOutcome outcome = fixture.upload("ops/runbook.txt", RUNBOOK);

        fixture.documents.delete(outcome.documentId());

        assertEquals(IngestionJobState.CANCELLED, fixture.queue.getStatus(outcome.jobId()).orElseThrow().state());
        assertTrue(fixture.drainQueue().isEmpty());
    }

    @Test
    void deletingUnknownDocumentThrows() {
        fixture = new IndexingFixture(contentRoot);

        assertThrows(DocumentNotFoundException.class, () -> fixture.documents.delete("missing"));
    }

    @Test
    void listFiltersByPathPrefix() {
        fixture = new IndexingFixture(contentRoot);
        fixture.upload("ops/runbook.txt", RUNBOOK);
        fixture.upload("ops/oncall.txt", "Escalate after fifteen minutes.");
        fixture.upload("design/adr-1.txt", "Use Lucene for keyword search.");

        assertEquals(2, fixture.documents.list(IndexingFixture.SCOPE, "ops/").size());
        assertEquals(3, fixture.documents.list(IndexingFixture.SCOPE, "").size());
        assertTrue(fixture.documents.list("other-scope", "").isEmpty());
    }

    @Test
    void leadingSlashesAndBackslashesAreNormalized() {
        assertEquals("ops/runbook.txt", DocumentIngestionService.normalizePath("//ops\\runbook.txt "));
    }

    private static SearchRequest keywordQuery(String query) {
        return SearchRequest.of(query, IndexingFixture.SCOPE).withMode(SearchMode.KEYWORD);
    }
}
