package io.kestra.plugin.groupby.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Text chunk stored as indices into a deduplicated lookup table. A null row has index {@code -1}.
 */
public final class DictionaryChunk extends ColumnChunk {
    public static final int NULL_INDEX = -1;

    private final int[] indices;
    private final List<String> dictionary;

    public DictionaryChunk(int[] indices, List<String> dictionary) {
        for (int index : indices) {
            if (index < NULL_INDEX || index >= dictionary.size()) {
                throw new IllegalArgumentException("Dictionary index " + index + " out of range [0, " + dictionary.size() + ")");
            }
        }
        if (new HashSet<>(dictionary).size() != dictionary.size()) {
            throw new IllegalArgumentException("Dictionary entries must be unique: " + dictionary);
        }
        this.indices = indices;
        this.dictionary = List.copyOf(dictionary);
    }

    /**
     * Dictionary-encodes text values; entries keep first-seen order.
     */
    public static DictionaryChunk encode(List<String> values) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        int[] indices = new int[values.size()];
        for (int i = 0; i < indices.length; i++) {
            String value = values.get(i);
            indices[i] = value == null ? NULL_INDEX : positions.computeIfAbsent(value, v -> positions.size());
        }
        return new DictionaryChunk(indices, new ArrayList<>(positions.keySet()));
    }

    public int index(int row) {
        return indices[row];
    }

    public List<String> dictionary() {
        return dictionary;
    }

    @Override
    public int length() {
        return indices.length;
    }

    @Override
    public boolean isNull(int row) {
        return indices[row] == NULL_INDEX;
    }

    @Override
    public String get(int row) {
        int index = indices[row];
        return index == NULL_INDEX ? null : dictionary.get(index);
    }

    @Override
    public DictionaryChunk take(int[] rows) {
        int[] taken = new int[rows.length];
        for (int i = 0; i < rows.length; i++) {
            taken[i] = indices[rows[i]];
        }
        return new DictionaryChunk(taken, dictionary);
    }

    /**
     * Drops lookup entries no row references. Surviving entries keep their relative order.
     */
    public DictionaryChunk compact() {
        boolean[] used = usedEntries();
        int[] remap = new int[dictionary.size()];
        List<String> kept = new ArrayList<>();
        for (int i = 0; i < used.length; i++) {
            if (used[i]) {
                remap[i] = kept.size();
                kept.add(dictionary.get(i));
            } else {
                remap[i] = NULL_INDEX;
            }
        }
        if (kept.size() == dictionary.size()) {
            return this;
        }
        int[] compacted = new int[indices.length];
        for (int i = 0; i < indices.length; i++) {
            compacted[i] = indices[i] == NULL_INDEX ? NULL_INDEX : remap[indices[i]];
        }
        return new DictionaryChunk(compacted, kept);
    }

    public PlainChunk decode() {
        Object[] values = new Object[indices.length];
        for (int i = 0; i < indices.length; i++) {
            values[i] = get(i);
        }
        return new PlainChunk(values);
    }

    private boolean[] usedEntries() {
        boolean[] used = new boolean[dictionary.size()];
        for (int index : indices) {
            if (index != NULL_INDEX) {
                used[index] = true;
            }
        }
        return used;
    }

    @Override
    public String toString() {
        return "dictionary" + dictionary + " indices" + Arrays.toString(indices);
    }
}
