package com.williamcallahan.knowledgeindex.web;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the JSON error and success envelopes shared by every controller.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds an error response with status and message.
     *
     * @param status HTTP status code
     * @param message user-facing error message
     * @return response with {@code status} and {@code message}
     */
    public ResponseEntity<Map<String, Object>> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(errorBody(message, null));
    }

    /**
     * Builds an error response that also carries the exception message as {@code details}.
     *
     * @param status HTTP status code
     * @param message user-facing error message
     * @param exception exception that caused the failure
     * @return response with {@code status}, {@code message} and {@code details}
     */
    public ResponseEntity<Map<String, Object>> buildErrorResponse(
            HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(errorBody(message, describeException(exception)));
    }

    /**
     * Builds a success response merging the given data into the envelope.
     */
    public ResponseEntity<Map<String, Object>> buildSuccessResponse(HttpStatus status, Map<String, Object> data) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.putAll(data);
        return ResponseEntity.status(status).body(response);
    }

    public ResponseEntity<Map<String, Object>> buildSuccessResponse(String message) {
        return buildSuccessResponse(HttpStatus.OK, Map.of("message", message));
    }

    /**
     * Describes an exception by type and message, or null when there is none.
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        String message = exception.getMessage();
        String type = exception.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }

    private static Map<String, Object> errorBody(String message, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("message", message == null ? "" : message);
        if (details != null) {
            body.put("details", details);
        }
        return body;
    }
}
