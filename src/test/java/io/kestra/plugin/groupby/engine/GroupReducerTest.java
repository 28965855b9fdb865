package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.model.Aggregation;
import io.kestra.plugin.groupby.model.Operation;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.ColumnType;
import io.kestra.plugin.groupby.table.DictionaryChunk;
import io.kestra.plugin.groupby.table.Table;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

class GroupReducerTest {
    @Test
    void reducesEachGroupRange() {
        Column values = Column.of("B", ColumnType.FLOAT64, 4.0, null, 1.0, null, null, 2.0, 8.0);
        SortedGroups groups = groups(values, 3, 5);

        assertThat(reduce(Operation.SIZE, null, groups).toList(), is(List.of(3L, 2L, 2L)));
        assertThat(reduce(Operation.NUNIQUE, values, groups).toList(), is(List.of(2L, 0L, 2L)));
        assertThat(reduce(Operation.SUM, values, groups).toList(), is(Arrays.asList(5.0, null, 10.0)));
        assertThat(reduce(Operation.MEAN, values, groups).toList(), is(Arrays.asList(2.5, null, 5.0)));
        assertThat(reduce(Operation.MEDIAN, values, groups).toList(), is(Arrays.asList(2.5, null, 5.0)));
        assertThat(reduce(Operation.MIN, values, groups).toList(), is(Arrays.asList(1.0, null, 2.0)));
        assertThat(reduce(Operation.MAX, values, groups).toList(), is(Arrays.asList(4.0, null, 8.0)));
        assertThat(reduce(Operation.FIRST, values, groups).toList(), is(Arrays.asList(4.0, null, 2.0)));
    }

    @Test
    void medianOfOddCount() {
        Column values = Column.of("B", ColumnType.INT64, 9, 1, 5);

        assertThat(reduce(Operation.MEDIAN, values, groups(values)).toList(), is(List.of(5.0)));
    }

    @Test
    void keepsIntegerTypeForSumAndExtremes() {
        Column values = Column.of("B", ColumnType.INT32, 3, -7, 2);

        Column sum = reduce(Operation.SUM, values, groups(values));
        Column min = reduce(Operation.MIN, values, groups(values));

        assertThat(sum.type(), is(ColumnType.INT32));
        assertThat(sum.toList(), is(List.of(-2)));
        assertThat(min.toList(), is(List.of(-7)));
        assertThat(sum.format(), is(nullValue()));
    }

    @Test
    void minAndMaxOfDates() {
        Column values = Column.of("B", ColumnType.DATE, LocalDate.of(2021, 5, 5), LocalDate.of(2020, 1, 1));

        assertThat(reduce(Operation.MIN, values, groups(values)).toList(), is(List.of(LocalDate.of(2020, 1, 1))));
        assertThat(reduce(Operation.MAX, values, groups(values)).toList(), is(List.of(LocalDate.of(2021, 5, 5))));
    }

    @Test
    void dictionaryResultsDropUnusedEntries() {
        Column values = Column.dictionary("B", List.of("z", "a", "m", "a"));

        Column max = reduce(Operation.MAX, values, groups(values, 2));

        assertThat(max.isDictionary(), is(true));
        assertThat(max.toList(), is(List.of("z", "m")));
        assertThat(((DictionaryChunk) max.chunks().get(0)).dictionary(), is(List.of("z", "m")));
    }

    @Test
    void failsWithoutColumnForColumnOperation() {
        Column values = Column.of("B", ColumnType.INT64, 1);
        SortedGroups groups = groups(values);

        Assertions.assertThrows(
            IllegalArgumentException.class,
            () -> GroupReducer.reduce(new Aggregation(Operation.SUM, "B", "X"), null, groups)
        );
    }

    private static Column reduce(Operation operation, Column values, SortedGroups groups) {
        String colname = values == null ? "" : values.name();
        return GroupReducer.reduce(new Aggregation(operation, colname, "X"), values, groups);
    }

    /**
     * Groups over {@code values} as already sorted, split at {@code splits}.
     */
    private static SortedGroups groups(Column values, int... splits) {
        List<Long> keys = new java.util.ArrayList<>();
        for (int g = 0; g <= splits.length; g++) {
            keys.add((long) g);
        }
        return new SortedGroups(
            Table.of(Column.of("K", ColumnType.INT64, keys)),
            Table.of(values),
            splits
        );
    }
}
