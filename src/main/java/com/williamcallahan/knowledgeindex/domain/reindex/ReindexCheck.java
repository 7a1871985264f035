package com.williamcallahan.knowledgeindex.domain.reindex;

import java.util.Objects;

/**
 * Evaluation of a single document without enqueueing anything.
 *
 * @param documentId evaluated document
 * @param reason evaluation outcome
 * @param message diagnostic message, empty when none
 */
public record ReindexCheck(String documentId, ReindexReason reason, String message) {

    public ReindexCheck {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(reason, "reason");
        message = message == null ? "" : message;
    }

    public boolean needsReindex() {
        return reason.requiresReindex();
    }
}
