package org.broadinstitute.varspace.workspace;

import org.broadinstitute.varspace.utils.Utils;

import java.util.Collections;
import java.util.List;

/**
 * One page of a filtered and sorted table view.
 */
public final class Page {

    private final List<String> header;
    private final List<List<String>> rows;
    private final int totalMatching;
    private final int page;
    private final int rowsPerPage;

    public Page(final List<String> header, final List<List<String>> rows, final int totalMatching, final int page, final int rowsPerPage) {
        this.header = Collections.unmodifiableList(Utils.nonNull(header));
        this.rows = Collections.unmodifiableList(Utils.nonNull(rows));
        this.totalMatching = totalMatching;
        this.page = page;
        this.rowsPerPage = rowsPerPage;
    }

    public List<String> getHeader() {
        return header;
    }

    /**
     * The rows of this page, in view order.
     */
    public List<List<String>> getRows() {
        return rows;
    }

    /**
     * Number of rows matching the filter across all pages.
     */
    public int getTotalMatching() {
        return totalMatching;
    }

    public int getPage() {
        return page;
    }

    public int getRowsPerPage() {
        return rowsPerPage;
    }

    public int getPageCount() {
        return (totalMatching + rowsPerPage - 1) / rowsPerPage;
    }

    @Override
    public String toString() {
        return String.format("Page{page=%d, rows=%d, totalMatching=%d}", page, rows.size(), totalMatching);
    }
}
