package com.williamcallahan.knowledgeindex.web;

import com.williamcallahan.knowledgeindex.domain.reindex.ReindexRequest;
import java.util.List;

/**
 * Request body for the reindex endpoint.
 *
 * @param documentIds explicit documents to evaluate; takes precedence over the scope
 * @param scopeId scope to evaluate when no ids are given
 * @param pathPrefix optional path prefix within the scope
 * @param force reindex regardless of detected changes, defaults to false
 * @param detectSettingsChanges compare recorded settings against the current ones, defaults to true
 */
public record ReindexBatchRequest(
        List<String> documentIds, String scopeId, String pathPrefix, Boolean force, Boolean detectSettingsChanges) {

    /**
     * Converts the body into a reindex request, applying defaults for omitted flags.
     */
    public ReindexRequest toReindexRequest() {
        return new ReindexRequest(
                documentIds,
                scopeId,
                pathPrefix,
                Boolean.TRUE.equals(force),
                detectSettingsChanges == null || detectSettingsChanges);
    }
}
