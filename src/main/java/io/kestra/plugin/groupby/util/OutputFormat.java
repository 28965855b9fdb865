package io.kestra.plugin.groupby.util;

/**
 * Ion encoding used when writing records.
 */
public enum OutputFormat {
    TEXT,
    BINARY
}
