package com.williamcallahan.knowledgeindex.domain.reindex;

/**
 * Why a document was, or was not, selected for reindexing.
 *
 * <p>When several conditions hold, the earliest constant among FORCED, CONTENT_CHANGED,
 * EMBEDDING_SETTINGS_CHANGED, CHUNKING_SETTINGS_CHANGED, NEVER_INDEXED and UNCHANGED is reported.</p>
 */
public enum ReindexReason {
    FORCED(true),
    CONTENT_CHANGED(true),
    EMBEDDING_SETTINGS_CHANGED(true),
    CHUNKING_SETTINGS_CHANGED(true),
    NEVER_INDEXED(true),
    UNCHANGED(false),
    FILE_NOT_FOUND(false),
    ERROR(false);

    private final boolean requiresReindex;

    ReindexReason(boolean requiresReindex) {
        this.requiresReindex = requiresReindex;
    }

    public boolean requiresReindex() {
        return requiresReindex;
    }
}
