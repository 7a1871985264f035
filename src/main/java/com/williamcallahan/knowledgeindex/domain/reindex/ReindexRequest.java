package com.williamcallahan.knowledgeindex.domain.reindex;

import java.util.List;

/**
 * Selects documents for a reindex batch.
 *
 * <p>Explicit document ids take precedence over the scope; with neither, the whole corpus is evaluated.</p>
 *
 * @param documentIds explicit document ids, empty for scope or corpus selection
 * @param scopeId scope to evaluate, empty for the whole corpus
 * @param pathPrefix optional path prefix within the scope
 * @param force reindex regardless of detected changes
 * @param detectSettingsChanges compare recorded chunking and embedding settings against the current ones
 */
public record ReindexRequest(
        List<String> documentIds, String scopeId, String pathPrefix, boolean force, boolean detectSettingsChanges) {

    public ReindexRequest {
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
        scopeId = scopeId == null ? "" : scopeId;
        pathPrefix = pathPrefix == null ? "" : pathPrefix;
    }

    public static ReindexRequest forDocuments(List<String> documentIds, boolean force) {
        return new ReindexRequest(documentIds, "", "", force, true);
    }

    public static ReindexRequest forScope(String scopeId, boolean force) {
        return new ReindexRequest(List.of(), scopeId, "", force, true);
    }

    public static ReindexRequest forCorpus(boolean force) {
        return new ReindexRequest(List.of(), "", "", force, true);
    }
}
