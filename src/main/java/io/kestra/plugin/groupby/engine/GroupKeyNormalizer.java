package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.model.DateGranularity;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.ColumnChunk;
import io.kestra.plugin.groupby.table.ColumnType;
import io.kestra.plugin.groupby.table.PlainChunk;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class GroupKeyNormalizer {
    private GroupKeyNormalizer() {
    }

    /**
     * Floors every timestamp of {@code column} to the start of its {@code granularity} bucket. Nulls stay null and
     * chunk boundaries are kept. Without a granularity the column is returned unchanged.
     *
     * @throws IllegalArgumentException if a granularity is given for a column that is not a timestamp column
     */
    public static Column normalize(Column column, DateGranularity granularity) {
        if (granularity == null) {
            return column;
        }
        if (column.type() != ColumnType.TIMESTAMP) {
            throw new IllegalArgumentException("Cannot bucket column '" + column.name() + "' of type "
                + column.type() + " by " + granularity.unit());
        }
        List<ColumnChunk> floored = new ArrayList<>(column.chunks().size());
        for (ColumnChunk chunk : column.chunks()) {
            Object[] values = new Object[chunk.length()];
            for (int i = 0; i < values.length; i++) {
                Instant instant = (Instant) chunk.get(i);
                values[i] = instant == null ? null : granularity.floor(instant);
            }
            floored.add(new PlainChunk(values));
        }
        return Column.chunked(column.name(), ColumnType.TIMESTAMP, floored).withFormat(column.format());
    }
}
