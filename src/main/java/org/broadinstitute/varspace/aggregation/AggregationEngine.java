package org.broadinstitute.varspace.aggregation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.query.FilterSpec;
import org.broadinstitute.varspace.query.NumericCells;
import org.broadinstitute.varspace.query.QueryEngine;
import org.broadinstitute.varspace.table.Table;
import org.broadinstitute.varspace.utils.Utils;
import org.broadinstitute.varspace.workspace.FileStore;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Computes column statistics over every row of a file that matches a filter, not only over a page.
 */
public final class AggregationEngine {

    private static final Logger logger = LogManager.getLogger(AggregationEngine.class);

    private final FileStore store;

    public AggregationEngine(final FileStore store) {
        this.store = Utils.nonNull(store, "the file store cannot be null");
    }

    /**
     * Aggregates one column.
     *
     * @throws UserException.ValidationError if {@code action} is {@code NONE} or a column is unknown.
     * @throws UserException.NotFound        if the file does not exist.
     */
    public AggregationResult computeAggregation(final String fileId, final String column, final AggregationAction action, final FilterSpec filter) {
        Utils.nonNull(action, "the action cannot be null");
        if (action == AggregationAction.NONE) {
            throw new UserException.ValidationError("'none' removes an aggregation and cannot be computed");
        }
        final Table table = store.readTable(fileId);
        final List<Integer> rows = QueryEngine.filterRows(table, Utils.nonNull(filter, "the filter cannot be null"));
        return aggregate(table, rows, table.requireColumn(column), action);
    }

    /**
     * Computes every aggregation of {@code spec} from one read of the file.
     *
     * @return a copy of {@code spec} with the results filled in; {@code NONE} entries are removed.
     */
    public AggregationSpec computeAll(final String fileId, final AggregationSpec spec, final FilterSpec filter) {
        Utils.nonNull(spec, "the aggregation spec cannot be null");
        final Table table = store.readTable(fileId);
        final List<Integer> rows = QueryEngine.filterRows(table, Utils.nonNull(filter, "the filter cannot be null"));

        AggregationSpec result = spec;
        for (final Map.Entry<String, AggregationSpec.Entry> entry : spec.entries().entrySet()) {
            final AggregationAction action = entry.getValue().getAction();
            if (action == AggregationAction.NONE) {
                result = result.without(entry.getKey());
            } else {
                result = result.withResult(entry.getKey(), aggregate(table, rows, table.requireColumn(entry.getKey()), action));
            }
        }
        logger.debug("Computed " + result.entries().size() + " aggregations over " + rows.size() + " rows of " + fileId);
        return result;
    }

    static AggregationResult aggregate(final Table table, final List<Integer> rows, final int column, final AggregationAction action) {
        if (action == AggregationAction.COUNT) {
            return new AggregationResult(action, OptionalDouble.of(rows.size()), 0, rows.size());
        }

        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int numeric = 0;
        int skipped = 0;
        for (final int row : rows) {
            final Double value = NumericCells.parse(table.cell(row, column));
            if (value == null) {
                skipped++;
                continue;
            }
            numeric++;
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        final OptionalDouble value;
        if (numeric == 0) {
            value = OptionalDouble.empty();
        } else {
            switch (action) {
                case SUM: value = OptionalDouble.of(sum); break;
                case AVG: value = OptionalDouble.of(sum / numeric); break;
                case MIN: value = OptionalDouble.of(min); break;
                case MAX: value = OptionalDouble.of(max); break;
                default:
                    throw new UserException.ValidationError("cannot aggregate with " + action);
            }
        }
        return new AggregationResult(action, value, skipped, rows.size());
    }
}
