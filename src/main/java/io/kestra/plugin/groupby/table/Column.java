package io.kestra.plugin.groupby.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named, typed sequence of nullable values, split into one or more chunks.
 * <p>
 * Every chunk shares the column's {@link ColumnType}. A dictionary column is a {@link ColumnType#TEXT} column
 * whose chunks are all {@link DictionaryChunk}s. {@code format} is the number display format carried as
 * column metadata, for example {@code "{:,d}"}; it is {@code null} when the column has none.
 * </p>
 */
public final class Column {
    private final String name;
    private final ColumnType type;
    private final String format;
    private final boolean dictionary;
    private final List<ColumnChunk> chunks;
    private final int[] chunkOffsets;
    private final int length;

    private Column(String name, ColumnType type, String format, boolean dictionary, List<? extends ColumnChunk> chunks) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.type = Objects.requireNonNull(type, "type is required");
        this.format = format;
        this.dictionary = dictionary;
        this.chunks = List.copyOf(chunks);
        if (dictionary && type != ColumnType.TEXT) {
            throw new IllegalArgumentException("Dictionary column '" + name + "' must be TEXT, got " + type);
        }
        this.chunkOffsets = new int[this.chunks.size() + 1];
        for (int c = 0; c < this.chunks.size(); c++) {
            ColumnChunk chunk = this.chunks.get(c);
            if (dictionary != chunk instanceof DictionaryChunk) {
                throw new IllegalArgumentException("Column '" + name + "' mixes dictionary and plain chunks");
            }
            for (int i = 0; i < chunk.length(); i++) {
                if (!type.accepts(chunk.get(i))) {
                    throw new IllegalArgumentException("Column '" + name + "' of type " + type
                        + " cannot hold " + chunk.get(i).getClass().getSimpleName() + " value " + chunk.get(i));
                }
            }
            chunkOffsets[c + 1] = chunkOffsets[c] + chunk.length();
        }
        this.length = chunkOffsets[this.chunks.size()];
    }

    public static Column of(String name, ColumnType type, Object... values) {
        return of(name, type, Arrays.asList(values));
    }

    public static Column of(String name, ColumnType type, List<?> values) {
        Object[] coerced = new Object[values.size()];
        for (int i = 0; i < coerced.length; i++) {
            coerced[i] = coerce(type, values.get(i));
        }
        return new Column(name, type, null, false, List.of(new PlainChunk(coerced)));
    }

    public static Column dictionary(String name, List<String> values) {
        return new Column(name, ColumnType.TEXT, null, true, List.of(DictionaryChunk.encode(values)));
    }

    public static Column chunked(String name, ColumnType type, List<? extends ColumnChunk> chunks) {
        boolean dictionary = !chunks.isEmpty() && chunks.get(0) instanceof DictionaryChunk;
        return new Column(name, type, null, dictionary, chunks);
    }

    public static Column fromChunk(String name, ColumnType type, String format, ColumnChunk chunk) {
        return new Column(name, type, format, chunk instanceof DictionaryChunk, List.of(chunk));
    }

    /**
     * A zero-row column; {@code dictionary} selects the encoding of that (empty) column.
     */
    public static Column empty(String name, ColumnType type, boolean dictionary) {
        ColumnChunk chunk = dictionary
            ? new DictionaryChunk(new int[0], List.of())
            : new PlainChunk(new Object[0]);
        return new Column(name, type, null, dictionary, List.of(chunk));
    }

    public String name() {
        return name;
    }

    public ColumnType type() {
        return type;
    }

    public String format() {
        return format;
    }

    public boolean isDictionary() {
        return dictionary;
    }

    public List<ColumnChunk> chunks() {
        return chunks;
    }

    public int length() {
        return length;
    }

    public Column withName(String newName) {
        return new Column(newName, type, format, dictionary, chunks);
    }

    public Column withFormat(String newFormat) {
        return new Column(name, type, newFormat, dictionary, chunks);
    }

    public boolean isNull(int row) {
        int c = chunkIndex(row);
        return chunks.get(c).isNull(row - chunkOffsets[c]);
    }

    public Object get(int row) {
        int c = chunkIndex(row);
        return chunks.get(c).get(row - chunkOffsets[c]);
    }

    public int nullCount() {
        int count = 0;
        for (ColumnChunk chunk : chunks) {
            count += chunk.nullCount();
        }
        return count;
    }

    /**
     * The whole column as a single chunk. Dictionary chunks with differing lookup tables are unified.
     */
    public ColumnChunk combined() {
        if (chunks.size() == 1) {
            return chunks.get(0);
        }
        if (!dictionary) {
            Object[] values = new Object[length];
            for (int c = 0; c < chunks.size(); c++) {
                ColumnChunk chunk = chunks.get(c);
                for (int i = 0; i < chunk.length(); i++) {
                    values[chunkOffsets[c] + i] = chunk.get(i);
                }
            }
            return new PlainChunk(values);
        }
        Map<String, Integer> positions = new LinkedHashMap<>();
        int[] indices = new int[length];
        for (int c = 0; c < chunks.size(); c++) {
            DictionaryChunk chunk = (DictionaryChunk) chunks.get(c);
            int[] remap = new int[chunk.dictionary().size()];
            for (int e = 0; e < remap.length; e++) {
                remap[e] = positions.computeIfAbsent(chunk.dictionary().get(e), v -> positions.size());
            }
            for (int i = 0; i < chunk.length(); i++) {
                int index = chunk.index(i);
                indices[chunkOffsets[c] + i] = index == DictionaryChunk.NULL_INDEX ? index : remap[index];
            }
        }
        return new DictionaryChunk(indices, new ArrayList<>(positions.keySet()));
    }

    public Column combineChunks() {
        if (chunks.size() == 1) {
            return this;
        }
        return new Column(name, type, format, dictionary, List.of(combined()));
    }

    /**
     * Gathers {@code rows}, in the given order, into a new single-chunk column with the same encoding.
     */
    public Column take(int[] rows) {
        for (int row : rows) {
            if (row < 0 || row >= length) {
                throw new IllegalArgumentException("Row " + row + " out of range [0, " + length + ") in column '" + name + "'");
            }
        }
        return new Column(name, type, format, dictionary, List.of(combined().take(rows)));
    }

    public List<Object> toList() {
        List<Object> values = new ArrayList<>(length);
        for (ColumnChunk chunk : chunks) {
            for (int i = 0; i < chunk.length(); i++) {
                values.add(chunk.get(i));
            }
        }
        return values;
    }

    private int chunkIndex(int row) {
        if (row < 0 || row >= length) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range [0, " + length + ") in column '" + name + "'");
        }
        int search = Arrays.binarySearch(chunkOffsets, row);
        int c = search >= 0 ? search : -search - 2;
        while (chunks.get(c).length() == 0) {
            c++;
        }
        return c;
    }

    private static Object coerce(ColumnType type, Object value) {
        if (!(value instanceof Number number)) {
            return value;
        }
        return switch (type) {
            case INT32 -> value instanceof Integer ? value : Math.toIntExact(number.longValue());
            case INT64 -> value instanceof Long ? value : number.longValue();
            case FLOAT64 -> value instanceof Double ? value : number.doubleValue();
            default -> value;
        };
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Column that)) {
            return false;
        }
        return dictionary == that.dictionary
            && name.equals(that.name)
            && type == that.type
            && Objects.equals(format, that.format)
            && toList().equals(that.toList());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, format, dictionary, toList());
    }

    @Override
    public String toString() {
        return name + ":" + type + (dictionary ? "(dictionary)" : "") + (format == null ? "" : "[" + format + "]") + toList();
    }
}
