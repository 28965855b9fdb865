package io.kestra.plugin.groupby.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered sequence of uniquely-named columns of equal length. A table may have zero columns and still carry a row
 * count.
 */
public final class Table {
    private final List<Column> columns;
    private final int rowCount;

    private Table(int rowCount, List<Column> columns) {
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must be >= 0, got " + rowCount);
        }
        Set<String> names = new HashSet<>();
        for (Column column : columns) {
            if (!names.add(column.name())) {
                throw new IllegalArgumentException("Duplicate column name '" + column.name() + "'");
            }
            if (column.length() != rowCount) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.length()
                    + " rows, expected " + rowCount);
            }
        }
        this.columns = List.copyOf(columns);
        this.rowCount = rowCount;
    }

    public static Table of(Column... columns) {
        return of(Arrays.asList(columns));
    }

    public static Table of(List<Column> columns) {
        return new Table(columns.isEmpty() ? 0 : columns.get(0).length(), columns);
    }

    public static Table of(int rowCount, List<Column> columns) {
        return new Table(rowCount, columns);
    }

    public static Table empty(int rowCount) {
        return new Table(rowCount, List.of());
    }

    public List<Column> columns() {
        return columns;
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.name());
        }
        return names;
    }

    public boolean hasColumn(String name) {
        for (Column column : columns) {
            if (column.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    public Column column(String name) {
        for (Column column : columns) {
            if (column.name().equals(name)) {
                return column;
            }
        }
        throw new IllegalArgumentException("Unknown column '" + name + "', table has " + columnNames());
    }

    /**
     * Keeps the named columns, in the given order.
     */
    public Table select(List<String> names) {
        List<Column> selected = new ArrayList<>(names.size());
        for (String name : names) {
            selected.add(column(name));
        }
        return new Table(rowCount, selected);
    }

    public Table take(int[] rows) {
        List<Column> taken = new ArrayList<>(columns.size());
        for (Column column : columns) {
            taken.add(column.take(rows));
        }
        return new Table(rows.length, taken);
    }

    /**
     * This table's columns followed by {@code others}, which must have the same row count.
     */
    public Table withColumns(List<Column> others) {
        List<Column> all = new ArrayList<>(columns);
        all.addAll(others);
        return new Table(rowCount, all);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Table that)) {
            return false;
        }
        return rowCount == that.rowCount && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowCount, columns);
    }

    @Override
    public String toString() {
        return "Table(" + rowCount + " rows)" + columns;
    }
}
