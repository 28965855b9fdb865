package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.ColumnChunk;
import io.kestra.plugin.groupby.table.ColumnType;
import io.kestra.plugin.groupby.table.DictionaryChunk;
import io.kestra.plugin.groupby.table.Table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Finds group boundaries by stable-sorting the key columns and comparing adjacent rows.
 */
public final class GroupSplitDetector {
    private GroupSplitDetector() {
    }

    /**
     * @param keys  normalized grouping columns, one row per input row
     * @param input the input columns needed downstream
     */
    public static SortedGroups detect(Table keys, Table input, NullKeyPolicy nullKeyPolicy) {
        if (keys.rowCount() != input.rowCount()) {
            throw new IllegalArgumentException("Key table has " + keys.rowCount() + " rows, input has " + input.rowCount());
        }
        if (keys.columnCount() == 0) {
            return new SortedGroups(Table.empty(1), input, new int[0]);
        }

        List<KeyColumn> keyColumns = new ArrayList<>(keys.columnCount());
        for (Column column : keys.columns()) {
            keyColumns.add(KeyColumn.of(column));
        }

        List<Integer> candidates = new ArrayList<>(keys.rowCount());
        for (int row = 0; row < keys.rowCount(); row++) {
            if (nullKeyPolicy == NullKeyPolicy.KEEP || !anyNull(keyColumns, row)) {
                candidates.add(row);
            }
        }
        Integer[] boxed = candidates.toArray(new Integer[0]);
        // Object sort is stable: rows with equal keys keep their input order.
        Arrays.sort(boxed, rowComparator(keyColumns));
        int[] order = new int[boxed.length];
        for (int i = 0; i < boxed.length; i++) {
            order[i] = boxed[i];
        }

        int[] splits = new int[order.length];
        int splitCount = 0;
        for (int i = 1; i < order.length; i++) {
            if (!sameKey(keyColumns, order[i - 1], order[i])) {
                splits[splitCount++] = i;
            }
        }
        splits = Arrays.copyOf(splits, splitCount);

        int[] representatives = new int[order.length == 0 ? 0 : splitCount + 1];
        if (order.length > 0) {
            representatives[0] = order[0];
            for (int s = 0; s < splitCount; s++) {
                representatives[s + 1] = order[splits[s]];
            }
        }

        List<Column> groupKeys = new ArrayList<>(keys.columnCount());
        for (Column column : keys.columns()) {
            groupKeys.add(DictionaryEncoding.reencodeKey(column.take(representatives)));
        }
        return new SortedGroups(
            Table.of(representatives.length, groupKeys),
            input.take(order),
            splits
        );
    }

    private static boolean anyNull(List<KeyColumn> keyColumns, int row) {
        for (KeyColumn keyColumn : keyColumns) {
            if (keyColumn.chunk.isNull(row)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameKey(List<KeyColumn> keyColumns, int left, int right) {
        for (KeyColumn keyColumn : keyColumns) {
            if (keyColumn.compare(left, right) != 0) {
                return false;
            }
        }
        return true;
    }

    private static Comparator<Integer> rowComparator(List<KeyColumn> keyColumns) {
        return (left, right) -> {
            for (KeyColumn keyColumn : keyColumns) {
                int result = keyColumn.compare(left, right);
                if (result != 0) {
                    return result;
                }
            }
            return 0;
        };
    }

    /**
     * A key column flattened to one chunk. Dictionary text compares by the rank of its entry in text order, which
     * orders rows exactly as comparing the decoded strings would.
     */
    private static final class KeyColumn {
        private final ColumnType type;
        private final ColumnChunk chunk;
        private final int[] ranks;

        private KeyColumn(ColumnType type, ColumnChunk chunk, int[] ranks) {
            this.type = type;
            this.chunk = chunk;
            this.ranks = ranks;
        }

        static KeyColumn of(Column column) {
            ColumnChunk chunk = column.combined();
            if (!(chunk instanceof DictionaryChunk dictionaryChunk)) {
                return new KeyColumn(column.type(), chunk, null);
            }
            List<String> dictionary = dictionaryChunk.dictionary();
            Integer[] byText = new Integer[dictionary.size()];
            for (int i = 0; i < byText.length; i++) {
                byText[i] = i;
            }
            Arrays.sort(byText, (left, right) -> ColumnType.compareText(dictionary.get(left), dictionary.get(right)));
            int[] ranks = new int[byText.length];
            for (int rank = 0; rank < byText.length; rank++) {
                ranks[byText[rank]] = rank;
            }
            return new KeyColumn(column.type(), chunk, ranks);
        }

        int compare(int left, int right) {
            boolean leftNull = chunk.isNull(left);
            boolean rightNull = chunk.isNull(right);
            if (leftNull || rightNull) {
                return Boolean.compare(leftNull, rightNull);
            }
            if (ranks != null) {
                DictionaryChunk dictionaryChunk = (DictionaryChunk) chunk;
                return Integer.compare(ranks[dictionaryChunk.index(left)], ranks[dictionaryChunk.index(right)]);
            }
            return type.compare(chunk.get(left), chunk.get(right));
        }
    }
}
