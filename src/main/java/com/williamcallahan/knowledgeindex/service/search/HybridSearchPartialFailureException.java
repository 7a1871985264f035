package com.williamcallahan.knowledgeindex.service.search;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Signals that one or more retrieval branches failed during a hybrid query.
 *
 * <p>Raised only in strict mode; otherwise branch failures are reported as search notices.</p>
 */
public class HybridSearchPartialFailureException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final List<BranchFailure> branchFailures;

    /**
     * Creates a partial-failure exception with branch-specific failure details.
     *
     * @param message human-readable summary message
     * @param branchFailures branch-scoped failures
     */
    public HybridSearchPartialFailureException(String message, List<BranchFailure> branchFailures) {
        super(message);
        this.branchFailures = List.copyOf(Objects.requireNonNull(branchFailures, "branchFailures"));
    }

    public List<BranchFailure> branchFailures() {
        return branchFailures;
    }

    /**
     * Captures one retrieval branch failure.
     *
     * @param branch branch name, {@code vector} or {@code keyword}
     * @param failureType normalized failure type
     * @param failureDetails compact failure details
     */
    public record BranchFailure(String branch, String failureType, String failureDetails) implements Serializable {

        @Serial
        private static final long serialVersionUID = 1L;

        public BranchFailure {
            branch = sanitize(branch);
            failureType = sanitize(failureType);
            failureDetails = sanitize(failureDetails);
            if (branch.isBlank()) {
                throw new IllegalArgumentException("branch cannot be blank");
            }
            if (failureType.isBlank()) {
                throw new IllegalArgumentException("failureType cannot be blank");
            }
        }

        private static String sanitize(String rawValue) {
            return rawValue == null ? "" : rawValue.trim();
        }
    }
}
