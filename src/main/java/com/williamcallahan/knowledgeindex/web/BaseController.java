package com.williamcallahan.knowledgeindex.web;

import com.williamcallahan.knowledgeindex.store.DocumentNotFoundException;
import jakarta.validation.ConstraintViolationException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

/**
 * Base controller providing the shared error translation for every API endpoint.
 *
 * <p>Validation failures map to 400, unknown documents to 404 and anything else to 500. A full ingestion
 * queue is a return value, not an exception; subclasses answer it with {@link #queueFullResponse(String)}.</p>
 */
public abstract class BaseController {
    private static final Logger log = LoggerFactory.getLogger(BaseController.class);

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(IllegalArgumentException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({
        ConstraintViolationException.class,
        MethodArgumentNotValidException.class,
        HandlerMethodValidationException.class,
        ServletRequestBindingException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(Exception e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid request", e);
    }

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(DocumentNotFoundException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unhandled API error", e);
        return exceptionBuilder.buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Request failed", e);
    }

    /**
     * Answers a request the ingestion queue could not accept.
     *
     * @param documentId document the rejected job belonged to
     * @return 503 response naming the document
     */
    protected ResponseEntity<Map<String, Object>> queueFullResponse(String documentId) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.SERVICE_UNAVAILABLE, "Ingestion queue is full; retry later (document " + documentId + ")");
    }
}
