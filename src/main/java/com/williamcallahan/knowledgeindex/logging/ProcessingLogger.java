package com.williamcallahan.knowledgeindex.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJob;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionResult;
import com.williamcallahan.knowledgeindex.domain.reindex.ReindexRequest;
import com.williamcallahan.knowledgeindex.domain.reindex.ReindexResult;
import com.williamcallahan.knowledgeindex.domain.search.SearchRequest;
import com.williamcallahan.knowledgeindex.domain.search.SearchResult;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logging aspect that times the top-level ingestion, search and reindex operations.
 *
 * <p>Arguments are reduced to identifiers and option values before they are written. Document content never
 * reaches the {@code PIPELINE} log.</p>
 */
@Aspect
@Component
public class ProcessingLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");
    private static final AtomicLong RUN_SEQUENCE = new AtomicLong();

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Log one document ingestion run
     */
    @Around("execution(* com.williamcallahan.knowledgeindex.service.ingestion.IngestionPipeline.process(..))")
    public Object logIngestion(ProceedingJoinPoint joinPoint) throws Throwable {
        return timed(joinPoint, "INGESTION");
    }

    /**
     * Log hybrid search queries
     */
    @Around("execution(* com.williamcallahan.knowledgeindex.service.search.HybridSearchService.search(..))")
    public Object logSearch(ProceedingJoinPoint joinPoint) throws Throwable {
        return timed(joinPoint, "SEARCH");
    }

    /**
     * Log reindex batches
     */
    @Around("execution(* com.williamcallahan.knowledgeindex.service.reindex.ReindexService.reindex(..))")
    public Object logReindex(ProceedingJoinPoint joinPoint) throws Throwable {
        return timed(joinPoint, "REINDEX");
    }

    private Object timed(ProceedingJoinPoint joinPoint, String step) throws Throwable {
        String runId = "RUN-" + RUN_SEQUENCE.incrementAndGet();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] {} - Starting", runId, step);
        if (PIPELINE_LOG.isDebugEnabled()) {
            PIPELINE_LOG.debug("[{}] {} arguments: {}", runId, step, describeArguments(joinPoint.getArgs()));
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            PIPELINE_LOG.info("[{}] {} - Completed in {}ms {}", runId, step, duration, describeResult(result));
            return result;
        } catch (Throwable failure) {
            long duration = System.currentTimeMillis() - startTime;
            PIPELINE_LOG.error("[{}] {} - Failed after {}ms: {}", runId, step, duration, failure.getMessage());
            throw failure;
        }
    }

    String describeArguments(Object[] args) {
        Map<String, Object> summary = new LinkedHashMap<>();
        for (Object arg : args) {
            if (arg instanceof IngestionJob job) {
                summary.put("jobId", job.jobId());
                summary.put("documentId", job.documentId());
                summary.put("path", job.path());
                summary.put("chunkingStrategy", job.options().chunkingStrategy());
            } else if (arg instanceof SearchRequest request) {
                summary.put("scopeId", request.scopeId());
                summary.put("queryLength", request.query().length());
                summary.put("pathPrefix", request.pathPrefix());
                summary.put("mode", request.mode() == null ? "default" : request.mode().name());
                summary.put("topK", request.topK() == null ? "default" : request.topK());
            } else if (arg instanceof ReindexRequest request) {
                summary.put("documentIds", request.documentIds().size());
                summary.put("scopeId", request.scopeId());
                summary.put("pathPrefix", request.pathPrefix());
                summary.put("force", request.force());
            }
        }
        try {
            return objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            return summary.toString();
        }
    }

    static String describeResult(Object result) {
        if (result instanceof IngestionResult ingestion) {
            return ingestion.success()
                    ? "(document " + ingestion.documentId() + ", " + ingestion.chunkCount() + " chunks)"
                    : "(document " + ingestion.documentId() + " failed)";
        }
        if (result instanceof SearchResult search) {
            return "(" + search.hits().size() + " hits of " + search.totalCandidates() + " candidates, "
                    + search.notices().size() + " notices)";
        }
        if (result instanceof ReindexResult reindex) {
            return "(" + reindex.enqueuedCount() + " enqueued, " + reindex.skippedCount() + " skipped, "
                    + reindex.failedCount() + " failed)";
        }
        return "";
    }
}
