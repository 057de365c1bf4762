package org.broadinstitute.varspace.query;

import org.broadinstitute.varspace.utils.Utils;

import java.util.Objects;

/**
 * A view of a table: which page, how many rows per page, and the sort and filter producing the row order.
 * <p>
 * The same request is used to read a page and to save edits back into it.
 * </p>
 */
public final class PageRequest {

    private final int page;
    private final int rowsPerPage;
    private final SortSpec sort;
    private final FilterSpec filter;

    public PageRequest(final int page, final int rowsPerPage, final SortSpec sort, final FilterSpec filter) {
        this.page = page;
        this.rowsPerPage = rowsPerPage;
        this.sort = Utils.nonNull(sort, "the sort cannot be null");
        this.filter = Utils.nonNull(filter, "the filter cannot be null");
    }

    public PageRequest(final int page, final int rowsPerPage) {
        this(page, rowsPerPage, SortSpec.none(), FilterSpec.none());
    }

    public int getPage() {
        return page;
    }

    public int getRowsPerPage() {
        return rowsPerPage;
    }

    public SortSpec getSort() {
        return sort;
    }

    public FilterSpec getFilter() {
        return filter;
    }

    public PageRequest withSort(final SortSpec newSort) {
        return new PageRequest(page, rowsPerPage, newSort, filter);
    }

    public PageRequest withFilter(final FilterSpec newFilter) {
        return new PageRequest(page, rowsPerPage, sort, newFilter);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof PageRequest)) return false;
        final PageRequest that = (PageRequest) o;
        return page == that.page && rowsPerPage == that.rowsPerPage && sort.equals(that.sort) && filter.equals(that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(page, rowsPerPage, sort, filter);
    }

    @Override
    public String toString() {
        return String.format("PageRequest{page=%d, rowsPerPage=%d, %s, %s}", page, rowsPerPage, sort, filter);
    }
}
