package io.kestra.plugin.groupby.model;

import java.util.Objects;

/**
 * One output column: {@code operation} applied to {@code colname}, written as {@code outname}.
 *
 * @param colname empty only for operations that do not read a column
 */
public record Aggregation(Operation operation, String colname, String outname) {
    public Aggregation {
        Objects.requireNonNull(operation, "operation is required");
        colname = colname == null ? "" : colname;
        if (operation.needsColumn() && colname.isEmpty()) {
            throw new IllegalArgumentException(operation.id() + " requires a column");
        }
        if (outname == null || outname.isEmpty()) {
            throw new IllegalArgumentException("Aggregation outname is required");
        }
    }
}
