package io.kestra.plugin.groupby.ion;

/**
 * An Ion value that cannot be read as the column type it belongs to.
 */
public class CastException extends Exception {
    private final String field;

    public CastException(String message) {
        this(null, message, null);
    }

    public CastException(String message, Throwable cause) {
        this(null, message, cause);
    }

    private CastException(String field, String message, Throwable cause) {
        super(field == null ? message : "Field '" + field + "' " + message, cause);
        this.field = field;
    }

    public static CastException forField(String field, String message) {
        return new CastException(field, message, null);
    }

    /**
     * Attaches the record field a value-level failure was raised for.
     */
    public static CastException forField(String field, CastException cause) {
        return new CastException(field, "- " + cause.getMessage(), cause);
    }

    /**
     * @return the record field, or {@code null} for a failure on a single value
     */
    public String getField() {
        return field;
    }
}
