package io.kestra.plugin.groupby.ion;

import com.amazon.ion.IonStruct;
import com.amazon.ion.IonSymbol;
import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.ColumnType;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.util.OutputFormat;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

class IonTablesTest {
    @Test
    void resolvesColumnTypesFromIonTypes() throws Exception {
        Table table = read("""
            {id: 1, price: 2.5, name: "a", active: true, day: 2021-05-05, at: 2021-05-05T01:02:03Z}
            {id: 2, price: 3, name: "b", active: false, day: 2021-05-06, at: 2021-05-06T01:02:03Z}
            """);

        assertThat(table.columnNames(), is(List.of("id", "price", "name", "active", "day", "at")));
        assertThat(table.column("id").type(), is(ColumnType.INT64));
        assertThat(table.column("price").type(), is(ColumnType.FLOAT64));
        assertThat(table.column("price").toList(), is(List.of(2.5, 3.0)));
        assertThat(table.column("name").type(), is(ColumnType.TEXT));
        assertThat(table.column("active").type(), is(ColumnType.BOOLEAN));
        assertThat(table.column("day").toList(), is(List.of(LocalDate.of(2021, 5, 5), LocalDate.of(2021, 5, 6))));
        assertThat(table.column("at").toList(), is(List.of(
            Instant.parse("2021-05-05T01:02:03Z"),
            Instant.parse("2021-05-06T01:02:03Z")
        )));
    }

    @Test
    void missingAndNullFieldsAreNull() throws Exception {
        Table table = read("""
            [{a: 1, b: null}, {c: "x"}]
            """);

        assertThat(table.rowCount(), is(2));
        assertThat(table.column("a").toList(), is(Arrays.asList(1L, null)));
        assertThat(table.column("b").type(), is(ColumnType.TEXT));
        assertThat(table.column("b").toList(), is(Arrays.asList(null, null)));
        assertThat(table.column("c").toList(), is(Arrays.asList(null, "x")));
    }

    @Test
    void symbolFieldsBecomeDictionaryColumns() throws Exception {
        Table table = read("{tag: red} {tag: blue} {tag: red}");

        Column tag = table.column("tag");
        assertThat(tag.isDictionary(), is(true));
        assertThat(tag.toList(), is(List.of("red", "blue", "red")));

        List<IonStruct> records = IonTables.toRecords(table);
        assertThat(records.get(0).get("tag") instanceof IonSymbol, is(true));
    }

    @Test
    void rejectsMixedTypes() {
        GroupByException exception = Assertions.assertThrows(
            GroupByException.class,
            () -> read("{a: 1} {a: \"x\"}")
        );

        assertThat(exception.getMessage(), is("Field 'a' mixes INT64 and TEXT values"));
        assertThat(((CastException) exception.getCause()).getField(), is("a"));
    }

    @Test
    void rejectsNonStructRecords() {
        Assertions.assertThrows(GroupByException.class, () -> read("1 2"));
    }

    @Test
    void writesTextRecords() throws Exception {
        Table table = Table.of(
            Column.of("A", ColumnType.TEXT, "x", null),
            Column.of("Group Size", ColumnType.INT64, 2, 1),
            Column.of("day", ColumnType.DATE, LocalDate.of(2021, 5, 5), LocalDate.of(2021, 5, 6))
        );

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        IonTables.write(table, output, OutputFormat.TEXT);

        Table reread = IonTables.read(new ByteArrayInputStream(output.toByteArray()));
        assertThat(reread, is(table));
    }

    @Test
    void writesBinaryRecords() throws Exception {
        Table table = Table.of(
            Column.of("at", ColumnType.TIMESTAMP, Instant.parse("2021-05-05T01:02:03Z")),
            Column.of("mean", ColumnType.FLOAT64, 2.5)
        );

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        IonTables.write(table, output, OutputFormat.BINARY);

        Table reread = IonTables.read(new ByteArrayInputStream(output.toByteArray()));
        assertThat(reread, is(table));
    }

    @Test
    void keepsSubMillisecondTimestamps() throws Exception {
        Table table = read("""
            {A: 2021-05-05T01:02:03.000001Z}
            {A: 2021-05-05T01:02:03.000002Z}
            """);

        assertThat(table.column("A").toList(), is(List.of(
            Instant.parse("2021-05-05T01:02:03.000001Z"),
            Instant.parse("2021-05-05T01:02:03.000002Z")
        )));

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        IonTables.write(table, output, OutputFormat.TEXT);
        Table reread = IonTables.read(new ByteArrayInputStream(output.toByteArray()));
        assertThat(reread, is(table));
    }

    @Test
    void convertsRowsToStructs() {
        List<IonStruct> records = IonTables.toRecords(Table.of(Column.of("A", ColumnType.INT64, 1, null)));

        assertThat(records, hasSize(2));
        assertThat(IonValueUtils.isNull(records.get(1).get("A")), is(true));
    }

    private static Table read(String ion) throws GroupByException {
        return IonTables.read(new ByteArrayInputStream(ion.getBytes(StandardCharsets.UTF_8)));
    }
}
