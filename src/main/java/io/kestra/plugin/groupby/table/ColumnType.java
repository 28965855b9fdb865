package io.kestra.plugin.groupby.table;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Logical type of a {@link Column}. Resolved once when the column is built and carried by the schema.
 */
public enum ColumnType {
    INT32(Integer.class),
    INT64(Long.class),
    FLOAT64(Double.class),
    TEXT(String.class),
    DATE(LocalDate.class),
    TIMESTAMP(Instant.class),
    BOOLEAN(Boolean.class);

    private final Class<?> valueClass;

    ColumnType(Class<?> valueClass) {
        this.valueClass = valueClass;
    }

    public Class<?> valueClass() {
        return valueClass;
    }

    public boolean isNumeric() {
        return this == INT32 || this == INT64 || this == FLOAT64;
    }

    public boolean isInteger() {
        return this == INT32 || this == INT64;
    }

    public boolean accepts(Object value) {
        return value == null || valueClass.isInstance(value);
    }

    /**
     * Ascending order of two non-null values of this type. Floats compare {@code -0.0} equal to {@code 0.0}; text
     * compares by Unicode code point.
     */
    public int compare(Object left, Object right) {
        return switch (this) {
            case INT32 -> Integer.compare((Integer) left, (Integer) right);
            case INT64 -> Long.compare((Long) left, (Long) right);
            case FLOAT64 -> Double.compare(canonicalDouble((Double) left), canonicalDouble((Double) right));
            case TEXT -> compareText((String) left, (String) right);
            case DATE -> ((LocalDate) left).compareTo((LocalDate) right);
            case TIMESTAMP -> ((Instant) left).compareTo((Instant) right);
            case BOOLEAN -> Boolean.compare((Boolean) left, (Boolean) right);
        };
    }

    /**
     * The value that stands for every value {@link #compare} finds equal to {@code value}, usable as a hash key.
     */
    public Object canonical(Object value) {
        if (this == FLOAT64 && value != null) {
            return canonicalDouble((Double) value);
        }
        return value;
    }

    public static int compareText(String left, String right) {
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < left.length() && rightIndex < right.length()) {
            int leftCodePoint = left.codePointAt(leftIndex);
            int rightCodePoint = right.codePointAt(rightIndex);
            if (leftCodePoint != rightCodePoint) {
                return Integer.compare(leftCodePoint, rightCodePoint);
            }
            leftIndex += Character.charCount(leftCodePoint);
            rightIndex += Character.charCount(rightCodePoint);
        }
        return Boolean.compare(leftIndex < left.length(), rightIndex < right.length());
    }

    private static double canonicalDouble(double value) {
        return value == 0.0 ? 0.0 : value;
    }
}
