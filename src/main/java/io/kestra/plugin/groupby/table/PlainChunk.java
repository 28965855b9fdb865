package io.kestra.plugin.groupby.table;

import java.util.Arrays;
import java.util.List;

public final class PlainChunk extends ColumnChunk {
    private final Object[] values;

    public PlainChunk(Object[] values) {
        this.values = values;
    }

    public static PlainChunk of(List<?> values) {
        return new PlainChunk(values.toArray());
    }

    @Override
    public int length() {
        return values.length;
    }

    @Override
    public boolean isNull(int row) {
        return values[row] == null;
    }

    @Override
    public Object get(int row) {
        return values[row];
    }

    @Override
    public PlainChunk take(int[] rows) {
        Object[] taken = new Object[rows.length];
        for (int i = 0; i < rows.length; i++) {
            taken[i] = values[rows[i]];
        }
        return new PlainChunk(taken);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
