package com.williamcallahan.knowledgeindex.web;

import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionBatchStatus;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobStatus;
import com.williamcallahan.knowledgeindex.service.ingestion.IngestionQueue;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Job status and cancellation for queued ingestion work.
 */
@RestController
@RequestMapping("/api/ingestion")
public class IngestionController extends BaseController {

    private final IngestionQueue ingestionQueue;

    public IngestionController(IngestionQueue ingestionQueue, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.ingestionQueue = ingestionQueue;
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> jobStatus(@PathVariable("jobId") String jobId) {
        Optional<IngestionJobStatus> status = ingestionQueue.getStatus(jobId);
        if (status.isEmpty()) {
            return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, "Job not found: " + jobId);
        }
        return ResponseEntity.ok(status.get());
    }

    @GetMapping("/jobs")
    public List<IngestionJobStatus> jobs() {
        return ingestionQueue.allStatuses();
    }

    /**
     * Aggregated progress of a reindex batch.
     */
    @GetMapping("/batches/{batchId}")
    public ResponseEntity<?> batchStatus(@PathVariable("batchId") String batchId) {
        Optional<IngestionBatchStatus> status = ingestionQueue.getBatchStatus(batchId);
        if (status.isEmpty()) {
            return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, "Batch not found: " + batchId);
        }
        return ResponseEntity.ok(status.get());
    }

    /**
     * Cancels whichever job currently owns the document.
     */
    @PostMapping("/documents/{documentId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable("documentId") String documentId) {
        if (!ingestionQueue.cancelJobForDocument(documentId)) {
            return exceptionBuilder.buildErrorResponse(
                    HttpStatus.NOT_FOUND, "No queued or running job for document " + documentId);
        }
        return exceptionBuilder.buildSuccessResponse("Cancellation requested for document " + documentId);
    }
}
