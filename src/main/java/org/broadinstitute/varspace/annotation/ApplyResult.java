package org.broadinstitute.varspace.annotation;

/**
 * Outcome of an apply run: the written file and how many of its rows got scores.
 */
public final class ApplyResult {

    private final String fileId;
    private final int resolved;
    private final int unresolved;

    public ApplyResult(final String fileId, final int resolved, final int unresolved) {
        this.fileId = fileId;
        this.resolved = resolved;
        this.unresolved = unresolved;
    }

    public String getFileId() {
        return fileId;
    }

    /**
     * Rows that received at least one score.
     */
    public int getResolved() {
        return resolved;
    }

    /**
     * Rows whose appended cells are all NA.
     */
    public int getUnresolved() {
        return unresolved;
    }

    @Override
    public String toString() {
        return String.format("ApplyResult{%s, resolved=%d, unresolved=%d}", fileId, resolved, unresolved);
    }
}
