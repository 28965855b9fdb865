package io.kestra.plugin.groupby.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Operation {
    SIZE,
    NUNIQUE,
    SUM,
    MEAN,
    MEDIAN,
    MIN,
    MAX,
    FIRST;

    @JsonCreator
    public static Operation fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("operation is required");
        }
        for (Operation operation : values()) {
            if (operation.id().equals(id.trim().toLowerCase(Locale.ROOT))) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unsupported operation: " + id);
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the operation reads a source column. {@code size} only counts rows.
     */
    public boolean needsColumn() {
        return this != SIZE;
    }

    public boolean needsNumericColumn() {
        return switch (this) {
            case SUM, MEAN, MEDIAN -> true;
            case SIZE, NUNIQUE, MIN, MAX, FIRST -> false;
        };
    }

    /**
     * Output column name used when the configuration leaves it blank.
     */
    public String defaultOutname(String colname) {
        return switch (this) {
            case SIZE -> "Group Size";
            case NUNIQUE -> "Unique count of " + colname;
            case SUM -> "Sum of " + colname;
            case MEAN -> "Average of " + colname;
            case MEDIAN -> "Median of " + colname;
            case MIN -> "Minimum of " + colname;
            case MAX -> "Maximum of " + colname;
            case FIRST -> "First of " + colname;
        };
    }
}
