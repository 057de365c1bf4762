package org.broadinstitute.varspace.merge;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of a merge: the written file, its row count and how many rows each source contributed.
 */
public final class MergeResult {

    private final String fileId;
    private final int rowCount;
    private final Map<SourceRole, Integer> perRoleCounts;
    private final int unkeyedRows;

    public MergeResult(final String fileId, final int rowCount, final Map<SourceRole, Integer> perRoleCounts, final int unkeyedRows) {
        this.fileId = fileId;
        this.rowCount = rowCount;
        this.perRoleCounts = Collections.unmodifiableMap(new EnumMap<>(perRoleCounts));
        this.unkeyedRows = unkeyedRows;
    }

    public String getFileId() {
        return fileId;
    }

    /**
     * Number of rows written, unkeyed rows included.
     */
    public int getRowCount() {
        return rowCount;
    }

    /**
     * Number of source rows read per role.
     */
    public Map<SourceRole, Integer> getPerRoleCounts() {
        return perRoleCounts;
    }

    /**
     * Number of source rows whose key could not be derived and which were written unjoined.
     */
    public int getUnkeyedRows() {
        return unkeyedRows;
    }

    @Override
    public String toString() {
        return String.format("MergeResult{%s, rows=%d, sources=%s, unkeyed=%d}", fileId, rowCount, perRoleCounts, unkeyedRows);
    }
}
