package io.kestra.plugin.groupby.table;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;

class ColumnTypeTest {
    @Test
    void comparesEachTypeInAscendingOrder() {
        assertThat(ColumnType.INT32.compare(1, 2), lessThan(0));
        assertThat(ColumnType.INT64.compare(3L, 2L), greaterThan(0));
        assertThat(ColumnType.FLOAT64.compare(-1.5, 0.5), lessThan(0));
        assertThat(ColumnType.BOOLEAN.compare(false, true), lessThan(0));
        assertThat(ColumnType.DATE.compare(LocalDate.of(2021, 5, 6), LocalDate.of(2021, 5, 5)), greaterThan(0));
        assertThat(
            ColumnType.TIMESTAMP.compare(Instant.parse("2021-05-05T01:02:03.000001Z"), Instant.parse("2021-05-05T01:02:03.000002Z")),
            lessThan(0)
        );
    }

    @Test
    void negativeZeroEqualsZero() {
        assertThat(ColumnType.FLOAT64.compare(-0.0, 0.0), is(0));
        assertThat(ColumnType.FLOAT64.canonical(-0.0), is((Object) 0.0));
        assertThat(ColumnType.TEXT.canonical("a"), is((Object) "a"));
    }

    @Test
    void comparesTextByCodePoint() {
        assertThat(ColumnType.compareText("｡", "😀"), lessThan(0));
        assertThat(ColumnType.compareText("😀", "😀a"), lessThan(0));
        assertThat(ColumnType.compareText("b", "a😀"), greaterThan(0));
        assertThat(ColumnType.compareText("😀", "😀"), is(0));
    }
}
