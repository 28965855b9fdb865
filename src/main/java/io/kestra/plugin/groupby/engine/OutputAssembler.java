package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.model.Operation;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.ColumnType;
import io.kestra.plugin.groupby.table.Table;

import java.util.List;

/**
 * Output schema rules and final table assembly.
 */
public final class OutputAssembler {
    public static final String COUNT_FORMAT = "{:,d}";
    public static final String DEFAULT_FLOAT_FORMAT = "{:,}";

    private OutputAssembler() {
    }

    /**
     * @param sourceType type of the aggregated column, {@code null} when the operation reads none
     */
    public static ColumnType outputType(Operation operation, ColumnType sourceType) {
        return switch (operation) {
            case SIZE, NUNIQUE -> ColumnType.INT64;
            case MEAN, MEDIAN -> ColumnType.FLOAT64;
            case SUM, MIN, MAX, FIRST -> sourceType;
        };
    }

    public static String outputFormat(Operation operation, String sourceFormat) {
        return switch (operation) {
            case SIZE, NUNIQUE -> COUNT_FORMAT;
            case MEAN, MEDIAN -> DEFAULT_FLOAT_FORMAT;
            case SUM, MIN, MAX, FIRST -> sourceFormat;
        };
    }

    /**
     * Group key columns in grouping order, then aggregate columns in aggregation order.
     */
    public static Table assemble(SortedGroups groups, List<Column> aggregates) {
        return groups.sortedGroupKeys().withColumns(aggregates);
    }
}
