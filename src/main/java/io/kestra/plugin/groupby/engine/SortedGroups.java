package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.table.Table;

/**
 * Input rows sorted by group key.
 *
 * @param sortedGroupKeys one row per group, in key order
 * @param sortedInput     the needed input columns, reordered to match, without excluded rows
 * @param groupSplits     strictly increasing offsets into {@code sortedInput} where each group after the first starts
 */
public record SortedGroups(Table sortedGroupKeys, Table sortedInput, int[] groupSplits) {
    public SortedGroups {
        int rows = sortedInput.rowCount();
        int previous = 0;
        for (int split : groupSplits) {
            if (split <= previous || split >= rows) {
                throw new IllegalArgumentException("Group split " + split + " out of order or range for " + rows + " rows");
            }
            previous = split;
        }
        boolean consistent = sortedGroupKeys.rowCount() == 0
            ? groupSplits.length == 0
            : sortedGroupKeys.rowCount() == groupSplits.length + 1;
        if (!consistent) {
            throw new IllegalArgumentException(sortedGroupKeys.rowCount() + " group keys for "
                + groupSplits.length + " group splits");
        }
    }

    public int groupCount() {
        return sortedGroupKeys.rowCount();
    }

    public int groupStart(int group) {
        return group == 0 ? 0 : groupSplits[group - 1];
    }

    public int groupEnd(int group) {
        return group == groupSplits.length ? sortedInput.rowCount() : groupSplits[group];
    }
}
