package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.ColumnChunk;
import io.kestra.plugin.groupby.table.DictionaryChunk;

/**
 * Re-encodes dictionary columns after rows have been filtered or gathered.
 */
final class DictionaryEncoding {
    private DictionaryEncoding() {
    }

    /**
     * For group keys: drops unreferenced entries, then falls back to plain text when every row has its own entry.
     */
    static Column reencodeKey(Column column) {
        if (!column.isDictionary()) {
            return column;
        }
        DictionaryChunk compacted = ((DictionaryChunk) column.combined()).compact();
        ColumnChunk chunk = compacted.length() == 0 || compacted.dictionary().size() < compacted.length()
            ? compacted
            : compacted.decode();
        return Column.fromChunk(column.name(), column.type(), column.format(), chunk);
    }

    /**
     * For aggregate values: drops unreferenced entries and keeps the dictionary encoding.
     */
    static ColumnChunk compact(ColumnChunk chunk) {
        if (chunk instanceof DictionaryChunk dictionaryChunk) {
            return dictionaryChunk.compact();
        }
        return chunk;
    }
}
