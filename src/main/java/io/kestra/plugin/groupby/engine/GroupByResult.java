package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.message.RenderError;
import io.kestra.plugin.groupby.table.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one group-by invocation.
 *
 * @param table  {@code null} when a configuration error prevented computing a result
 * @param errors the failure, or the advisories that accompany a table
 */
public record GroupByResult(
    Table table,
    List<RenderError> errors
) {
    public GroupByResult {
        errors = List.copyOf(errors);
    }

    public static GroupByResult success(Table table) {
        return new GroupByResult(table, List.of());
    }

    public static GroupByResult failure(RenderError error) {
        return new GroupByResult(null, List.of(error));
    }

    public boolean isSuccess() {
        return table != null;
    }

    public GroupByResult withAdvisories(List<RenderError> advisories) {
        if (advisories.isEmpty()) {
            return this;
        }
        List<RenderError> merged = new ArrayList<>(errors);
        merged.addAll(advisories);
        return new GroupByResult(table, merged);
    }
}
