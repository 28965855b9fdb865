package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.model.Aggregation;
import io.kestra.plugin.groupby.model.Operation;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.ColumnChunk;
import io.kestra.plugin.groupby.table.ColumnType;
import io.kestra.plugin.groupby.table.DictionaryChunk;
import io.kestra.plugin.groupby.table.PlainChunk;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Computes one aggregate per group over the row ranges of a {@link SortedGroups}.
 * <p>
 * Every aggregate except {@code size} and {@code nunique} skips null values, and yields null for a group without any
 * non-null value.
 * </p>
 */
public final class GroupReducer {
    private static final int NO_ROW = -1;

    private GroupReducer() {
    }

    /**
     * @param sortedColumn the aggregated column of {@link SortedGroups#sortedInput()}; may be {@code null} for
     *                     {@code size}
     * @return a column named {@code aggregation.outname()}, one row per group, without a format
     */
    public static Column reduce(Aggregation aggregation, Column sortedColumn, SortedGroups groups) {
        Operation operation = aggregation.operation();
        if (operation.needsColumn() && sortedColumn == null) {
            throw new IllegalArgumentException(operation.id() + " needs column '" + aggregation.colname() + "'");
        }
        ColumnType sourceType = sortedColumn == null ? null : sortedColumn.type();
        ColumnType outputType = OutputAssembler.outputType(operation, sourceType);
        boolean keepsDictionary = sortedColumn != null && sortedColumn.isDictionary()
            && (operation == Operation.MIN || operation == Operation.MAX || operation == Operation.FIRST);

        if (groups.groupCount() == 0) {
            return Column.empty(aggregation.outname(), outputType, keepsDictionary);
        }

        ColumnChunk values = operation == Operation.SIZE ? null : sortedColumn.combined();
        ColumnChunk reduced = switch (operation) {
            case SIZE -> size(groups);
            case NUNIQUE -> nunique(values, sourceType, groups);
            case SUM -> sum(values, sourceType, groups);
            case MEAN -> mean(values, groups);
            case MEDIAN -> median(values, groups);
            case MIN -> DictionaryEncoding.compact(gather(values, extremeRows(values, sourceType, groups, -1)));
            case MAX -> DictionaryEncoding.compact(gather(values, extremeRows(values, sourceType, groups, 1)));
            case FIRST -> DictionaryEncoding.compact(gather(values, firstRows(values, groups)));
        };
        return Column.fromChunk(aggregation.outname(), outputType, null, reduced);
    }

    private static ColumnChunk size(SortedGroups groups) {
        Object[] counts = new Object[groups.groupCount()];
        for (int g = 0; g < counts.length; g++) {
            counts[g] = (long) (groups.groupEnd(g) - groups.groupStart(g));
        }
        return new PlainChunk(counts);
    }

    private static ColumnChunk nunique(ColumnChunk values, ColumnType type, SortedGroups groups) {
        Object[] counts = new Object[groups.groupCount()];
        Set<Object> seen = new HashSet<>();
        for (int g = 0; g < counts.length; g++) {
            seen.clear();
            for (int row = groups.groupStart(g); row < groups.groupEnd(g); row++) {
                if (!values.isNull(row)) {
                    seen.add(type.canonical(values.get(row)));
                }
            }
            counts[g] = (long) seen.size();
        }
        return new PlainChunk(counts);
    }

    private static ColumnChunk sum(ColumnChunk values, ColumnType type, SortedGroups groups) {
        Object[] sums = new Object[groups.groupCount()];
        for (int g = 0; g < sums.length; g++) {
            boolean any = false;
            long integerSum = 0L;
            double floatSum = 0.0;
            for (int row = groups.groupStart(g); row < groups.groupEnd(g); row++) {
                if (values.isNull(row)) {
                    continue;
                }
                Number value = (Number) values.get(row);
                any = true;
                if (type.isInteger()) {
                    integerSum = Math.addExact(integerSum, value.longValue());
                } else {
                    floatSum += value.doubleValue();
                }
            }
            if (!any) {
                continue;
            }
            sums[g] = switch (type) {
                case INT32 -> Math.toIntExact(integerSum);
                case INT64 -> integerSum;
                case FLOAT64 -> floatSum;
                default -> throw new IllegalArgumentException("sum needs a numeric column, got " + type);
            };
        }
        return new PlainChunk(sums);
    }

    private static ColumnChunk mean(ColumnChunk values, SortedGroups groups) {
        Object[] means = new Object[groups.groupCount()];
        for (int g = 0; g < means.length; g++) {
            double total = 0.0;
            int count = 0;
            for (int row = groups.groupStart(g); row < groups.groupEnd(g); row++) {
                if (!values.isNull(row)) {
                    total += ((Number) values.get(row)).doubleValue();
                    count++;
                }
            }
            means[g] = count == 0 ? null : total / count;
        }
        return new PlainChunk(means);
    }

    private static ColumnChunk median(ColumnChunk values, SortedGroups groups) {
        Object[] medians = new Object[groups.groupCount()];
        for (int g = 0; g < medians.length; g++) {
            double[] present = new double[groups.groupEnd(g) - groups.groupStart(g)];
            int count = 0;
            for (int row = groups.groupStart(g); row < groups.groupEnd(g); row++) {
                if (!values.isNull(row)) {
                    present[count++] = ((Number) values.get(row)).doubleValue();
                }
            }
            if (count == 0) {
                continue;
            }
            Arrays.sort(present, 0, count);
            int middle = count / 2;
            medians[g] = count % 2 == 1 ? present[middle] : (present[middle - 1] + present[middle]) / 2.0;
        }
        return new PlainChunk(medians);
    }

    /**
     * Row of the smallest ({@code direction < 0}) or largest value of each group; the earliest row wins ties.
     */
    private static int[] extremeRows(ColumnChunk values, ColumnType type, SortedGroups groups, int direction) {
        int[] rows = new int[groups.groupCount()];
        for (int g = 0; g < rows.length; g++) {
            int best = NO_ROW;
            for (int row = groups.groupStart(g); row < groups.groupEnd(g); row++) {
                if (values.isNull(row)) {
                    continue;
                }
                if (best == NO_ROW || direction * type.compare(values.get(row), values.get(best)) > 0) {
                    best = row;
                }
            }
            rows[g] = best;
        }
        return rows;
    }

    private static int[] firstRows(ColumnChunk values, SortedGroups groups) {
        int[] rows = new int[groups.groupCount()];
        for (int g = 0; g < rows.length; g++) {
            rows[g] = NO_ROW;
            for (int row = groups.groupStart(g); row < groups.groupEnd(g); row++) {
                if (!values.isNull(row)) {
                    rows[g] = row;
                    break;
                }
            }
        }
        return rows;
    }

    /**
     * Picks {@code rows} out of {@code values}, keeping its encoding; {@link #NO_ROW} becomes null.
     */
    private static ColumnChunk gather(ColumnChunk values, int[] rows) {
        if (values instanceof DictionaryChunk dictionaryChunk) {
            int[] indices = new int[rows.length];
            for (int i = 0; i < rows.length; i++) {
                indices[i] = rows[i] == NO_ROW ? DictionaryChunk.NULL_INDEX : dictionaryChunk.index(rows[i]);
            }
            return new DictionaryChunk(indices, dictionaryChunk.dictionary());
        }
        Object[] gathered = new Object[rows.length];
        for (int i = 0; i < rows.length; i++) {
            gathered[i] = rows[i] == NO_ROW ? null : values.get(rows[i]);
        }
        return new PlainChunk(gathered);
    }
}
