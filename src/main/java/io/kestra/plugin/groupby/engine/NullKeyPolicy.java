package io.kestra.plugin.groupby.engine;

/**
 * What happens to rows with a null in any grouping column.
 */
public enum NullKeyPolicy {
    /**
     * Rows with a null key belong to no group. The default.
     */
    DROP,
    /**
     * Null is a key value of its own, sorted after every non-null value.
     */
    KEEP
}
