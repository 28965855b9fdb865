package io.kestra.plugin.groupby;

public class GroupByException extends Exception {
    public GroupByException(String message) {
        super(message);
    }

    public GroupByException(String message, Throwable cause) {
        super(message, cause);
    }
}
