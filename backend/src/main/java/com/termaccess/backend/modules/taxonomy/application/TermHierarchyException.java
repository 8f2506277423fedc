package com.termaccess.backend.modules.taxonomy.application;

/**
 * The term tree contains a cycle or is deeper than the configured traversal limit.
 */
public class TermHierarchyException extends RuntimeException {

    private final long termId;

    public TermHierarchyException(long termId, String message) {
        super(message);
        this.termId = termId;
    }

    public long getTermId() {
        return termId;
    }
}
