package com.williamcallahan.knowledgeindex.store;

import java.util.Objects;

/**
 * Scope and optional path-prefix restriction shared by the vector and keyword indexes.
 *
 * @param scopeId required scope
 * @param pathPrefix logical path prefix, empty for no restriction
 */
public record SearchFilter(String scopeId, String pathPrefix) {

    public SearchFilter {
        Objects.requireNonNull(scopeId, "scopeId");
        pathPrefix = pathPrefix == null ? "" : pathPrefix;
    }

    public static SearchFilter scope(String scopeId) {
        return new SearchFilter(scopeId, "");
    }

    public boolean hasPathPrefix() {
        return !pathPrefix.isEmpty();
    }

    public boolean matches(String candidateScopeId, String candidatePath) {
        if (!scopeId.equals(candidateScopeId)) {
            return false;
        }
        return !hasPathPrefix() || (candidatePath != null && candidatePath.startsWith(pathPrefix));
    }
}
