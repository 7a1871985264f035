package com.williamcallahan.knowledgeindex.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJob;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionOptions;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionResult;
import com.williamcallahan.knowledgeindex.domain.search.SearchRequest;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProcessingLoggerTest {

    private final ProcessingLogger processingLogger = new ProcessingLogger();

    @Test
    void searchArgumentsNeverIncludeQueryText() {
        String description = processingLogger.describeArguments(
                new Object[] {SearchRequest.of("salary bands for staff engineers", "hr").withTopK(5)});

        assertFalse(description.contains("salary"), description);
        assertTrue(description.contains("\"queryLength\":32"), description);
        assertTrue(description.contains("\"scopeId\":\"hr\""), description);
        assertTrue(description.contains("\"topK\":5"), description);
    }

    @Test
    void ingestionArgumentsCarryIdentifiersOnly() {
        IngestionJob job = IngestionJob.create("doc-7", "handbook/leave.md", IngestionOptions.forScope("hr"), "");

        String description = processingLogger.describeArguments(new Object[] {job, "ignored"});

        assertTrue(description.contains("\"documentId\":\"doc-7\""), description);
        assertTrue(description.contains("\"path\":\"handbook/leave.md\""), description);
    }

    @Test
    void resultSummaryReportsChunkCount() {
        IngestionResult result = new IngestionResult("doc-7", true, 4, "hash", Duration.ofMillis(3), "", List.of());

        assertEquals("(document doc-7, 4 chunks)", ProcessingLogger.describeResult(result));
        assertEquals("", ProcessingLogger.describeResult("other"));
    }
}
