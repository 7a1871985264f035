package com.williamcallahan.knowledgeindex.web;

import com.williamcallahan.knowledgeindex.domain.document.KnowledgeDocument;
import com.williamcallahan.knowledgeindex.domain.ingestion.UploadOutcome;
import com.williamcallahan.knowledgeindex.service.ingestion.DocumentIngestionService;
import jakarta.validation.constraints.NotBlank;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Upload, inspect, list and delete documents.
 */
@RestController
@RequestMapping("/api/documents")
@Validated
public class DocumentController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(DocumentController.class);

    private final DocumentIngestionService documentIngestionService;

    public DocumentController(
            DocumentIngestionService documentIngestionService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.documentIngestionService = documentIngestionService;
    }

    /**
     * Stores the uploaded bytes and queues them for indexing.
     *
     * @return 202 with the document and job ids, or 503 when the ingestion queue is full
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam("scopeId") @NotBlank(message = "scopeId is required") String scopeId,
            @RequestParam(name = "path", required = false) String path,
            @RequestParam(name = "strategy", required = false) String strategy)
            throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }
        log.info("Upload of {} ({} bytes) into scope {}", file.getOriginalFilename(), file.getSize(), scopeId);
        UploadOutcome outcome = documentIngestionService.upload(
                scopeId,
                path,
                file.getOriginalFilename(),
                file.getContentType(),
                file.getBytes(),
                strategy,
                Map.of());
        if (!outcome.enqueueResult().isAccepted()) {
            return queueFullResponse(outcome.documentId());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("documentId", outcome.documentId());
        body.put("jobId", outcome.jobId());
        body.put("duplicate", outcome.duplicate());
        return exceptionBuilder.buildSuccessResponse(HttpStatus.ACCEPTED, body);
    }

    @GetMapping("/{id}")
    public KnowledgeDocument get(@PathVariable("id") String id) {
        return documentIngestionService.require(id);
    }

    @GetMapping
    public List<KnowledgeDocument> list(
            @RequestParam(name = "scopeId", required = false) String scopeId,
            @RequestParam(name = "pathPrefix", required = false) String pathPrefix) {
        return documentIngestionService.list(scopeId, pathPrefix);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable("id") String id) {
        KnowledgeDocument removed = documentIngestionService.delete(id);
        return exceptionBuilder.buildSuccessResponse("Deleted document " + removed.id());
    }
}
