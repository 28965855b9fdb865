package io.kestra.plugin.groupby.ion;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonException;
import com.amazon.ion.IonFloat;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonList;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonText;
import com.amazon.ion.IonTimestamp;
import com.amazon.ion.IonValue;
import com.amazon.ion.IonWriter;
import com.amazon.ion.system.IonBinaryWriterBuilder;
import io.kestra.plugin.groupby.GroupByException;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.ColumnType;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.util.OutputFormat;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between Ion struct records and tables.
 * <p>
 * Column types are resolved once per field from the Ion types of its values: int is {@link ColumnType#INT64},
 * float and decimal are {@link ColumnType#FLOAT64}, string and symbol are {@link ColumnType#TEXT}, bool is
 * {@link ColumnType#BOOLEAN}, and timestamp is {@link ColumnType#TIMESTAMP}, or {@link ColumnType#DATE} when every
 * value has no time of day. A field of symbols only becomes a dictionary column.
 * </p>
 */
public final class IonTables {
    private IonTables() {
    }

    /**
     * Columns follow the order in which fields first appear. A field missing from a record is null there; a field
     * that is null everywhere is a text column.
     *
     * @throws CastException when a field mixes value types that share no column type
     */
    public static Table fromRecords(List<IonStruct> records) throws CastException {
        Map<String, FieldStats> fields = new LinkedHashMap<>();
        for (IonStruct record : records) {
            for (IonValue value : record) {
                FieldStats stats = fields.computeIfAbsent(value.getFieldName(), name -> new FieldStats());
                stats.add(value.getFieldName(), value);
            }
        }

        List<Column> columns = new ArrayList<>(fields.size());
        for (Map.Entry<String, FieldStats> entry : fields.entrySet()) {
            columns.add(toColumn(entry.getKey(), entry.getValue(), records));
        }
        return Table.of(records.size(), columns);
    }

    public static List<IonStruct> toRecords(Table table) {
        List<IonStruct> records = new ArrayList<>(table.rowCount());
        for (int row = 0; row < table.rowCount(); row++) {
            IonStruct record = IonValueUtils.system().newEmptyStruct();
            for (Column column : table.columns()) {
                Object value = column.get(row);
                IonValue ionValue = column.isDictionary() && value != null
                    ? IonValueUtils.system().newSymbol((String) value)
                    : IonValueUtils.toIonValue(value);
                record.put(column.name(), ionValue);
            }
            records.add(record);
        }
        return records;
    }

    /**
     * Reads every top-level struct of an Ion text or binary stream. A top-level list contributes its elements.
     */
    public static Table read(InputStream inputStream) throws GroupByException {
        List<IonStruct> records = new ArrayList<>();
        try {
            Iterator<IonValue> iterator = IonValueUtils.system().iterate(inputStream);
            while (iterator.hasNext()) {
                IonValue value = iterator.next();
                if (value instanceof IonList list) {
                    for (IonValue element : list) {
                        records.add(asStruct(element));
                    }
                } else {
                    records.add(asStruct(value));
                }
            }
            return fromRecords(records);
        } catch (IonException e) {
            throw new GroupByException("Unable to read Ion records", e);
        } catch (CastException e) {
            throw new GroupByException(e.getMessage(), e);
        }
    }

    /**
     * Writes one struct per row. The stream is flushed but left open.
     */
    public static void write(Table table, OutputStream outputStream, OutputFormat format) throws GroupByException {
        try {
            IonWriter writer = createWriter(outputStream, format);
            for (IonStruct record : toRecords(table)) {
                record.writeTo(writer);
                writer.flush();
                writeDelimiter(outputStream, format);
            }
            writer.finish();
            outputStream.flush();
        } catch (IOException e) {
            throw new GroupByException("Unable to write Ion records", e);
        }
    }

    private static IonWriter createWriter(OutputStream outputStream, OutputFormat format) {
        if (format == OutputFormat.BINARY) {
            return IonBinaryWriterBuilder.standard().build(outputStream);
        }
        return IonValueUtils.system().newTextWriter(outputStream);
    }

    private static void writeDelimiter(OutputStream outputStream, OutputFormat format) throws IOException {
        if (format == OutputFormat.TEXT) {
            outputStream.write('\n');
        }
    }

    private static IonStruct asStruct(IonValue value) throws GroupByException {
        if (value instanceof IonStruct struct) {
            return struct;
        }
        throw new GroupByException("Expected struct record, got " + (value == null ? "null" : value.getType()));
    }

    private static Column toColumn(String name, FieldStats stats, List<IonStruct> records) throws CastException {
        ColumnType type = stats.type == null ? ColumnType.TEXT : stats.type;
        List<Object> values = new ArrayList<>(records.size());
        for (IonStruct record : records) {
            IonValue value = record.get(name);
            try {
                values.add(switch (type) {
                    case INT64 -> IonValueUtils.asLong(value);
                    case FLOAT64 -> IonValueUtils.asDouble(value);
                    case TEXT -> IonValueUtils.asString(value);
                    case BOOLEAN -> IonValueUtils.asBoolean(value);
                    case DATE -> IonValueUtils.asLocalDate(value);
                    case TIMESTAMP -> IonValueUtils.asInstant(value);
                    case INT32 -> throw new IllegalStateException("Ion records never resolve to " + type);
                });
            } catch (CastException e) {
                throw CastException.forField(name, e);
            }
        }
        if (type == ColumnType.TEXT && stats.symbolsOnly && stats.nonNull > 0) {
            List<String> text = new ArrayList<>(values.size());
            for (Object value : values) {
                text.add((String) value);
            }
            return Column.dictionary(name, text);
        }
        return Column.of(name, type, values);
    }

    private static ColumnType typeOf(String field, IonValue value) throws CastException {
        if (value instanceof IonInt) {
            return ColumnType.INT64;
        }
        if (value instanceof IonFloat || value instanceof IonDecimal) {
            return ColumnType.FLOAT64;
        }
        if (value instanceof IonText) {
            return ColumnType.TEXT;
        }
        if (value instanceof IonBool) {
            return ColumnType.BOOLEAN;
        }
        if (value instanceof IonTimestamp timestamp) {
            return IonValueUtils.isDate(timestamp) ? ColumnType.DATE : ColumnType.TIMESTAMP;
        }
        throw CastException.forField(field, "holds unsupported " + value.getType() + " value");
    }

    private static final class FieldStats {
        private ColumnType type;
        private boolean symbolsOnly = true;
        private int nonNull;

        void add(String field, IonValue value) throws CastException {
            if (IonValueUtils.isNull(value)) {
                return;
            }
            nonNull++;
            symbolsOnly &= IonValueUtils.isSymbol(value);
            type = merge(field, type, typeOf(field, value));
        }

        private static ColumnType merge(String field, ColumnType current, ColumnType next) throws CastException {
            if (current == null || current == next) {
                return next;
            }
            if (current.isNumeric() && next.isNumeric()) {
                return ColumnType.FLOAT64;
            }
            if ((current == ColumnType.DATE || current == ColumnType.TIMESTAMP)
                && (next == ColumnType.DATE || next == ColumnType.TIMESTAMP)) {
                return ColumnType.TIMESTAMP;
            }
            throw CastException.forField(field, "mixes " + current + " and " + next + " values");
        }
    }
}
