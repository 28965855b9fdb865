package io.kestra.plugin.groupby.table;

/**
 * One contiguous segment of a {@link Column}.
 */
public abstract class ColumnChunk {
    public abstract int length();

    public abstract boolean isNull(int row);

    /**
     * Decoded value at {@code row}, or {@code null}.
     */
    public abstract Object get(int row);

    /**
     * Gathers the given rows into a new chunk of the same encoding.
     */
    public abstract ColumnChunk take(int[] rows);

    public int nullCount() {
        int count = 0;
        for (int i = 0; i < length(); i++) {
            if (isNull(i)) {
                count++;
            }
        }
        return count;
    }
}
