package io.kestra.plugin.groupby.model;

/**
 * A grouping key: a source column and, for timestamp columns, an optional bucket.
 *
 * @param granularity {@code null} when values are compared as-is
 */
public record Group(String colname, DateGranularity granularity) {
    public Group {
        if (colname == null || colname.isEmpty()) {
            throw new IllegalArgumentException("Group colname is required");
        }
    }

    public static Group of(String colname) {
        return new Group(colname, null);
    }
}
