package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.message.Messages;
import io.kestra.plugin.groupby.model.Aggregation;
import io.kestra.plugin.groupby.model.Group;
import io.kestra.plugin.groupby.table.Column;
import io.kestra.plugin.groupby.table.Table;
import io.kestra.plugin.groupby.util.GroupByProfiler;
import io.kestra.plugin.groupby.util.GroupByProfiler.Phase;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs the whole pipeline: normalize keys, sort and split, reduce each aggregation, assemble.
 * <p>
 * Group and aggregation column names must exist in the table; an unknown name raises
 * {@link IllegalArgumentException}. A numeric aggregation over a non-numeric column is reported as a failed
 * {@link GroupByResult} instead.
 * </p>
 */
@Slf4j
public final class DefaultGroupByEngine implements GroupByEngine {
    private final NullKeyPolicy nullKeyPolicy;

    public DefaultGroupByEngine() {
        this(NullKeyPolicy.DROP);
    }

    public DefaultGroupByEngine(NullKeyPolicy nullKeyPolicy) {
        this.nullKeyPolicy = Objects.requireNonNull(nullKeyPolicy, "nullKeyPolicy is required");
    }

    @Override
    public GroupByResult execute(Table table, List<Group> groups, List<Aggregation> aggregations) {
        GroupByProfiler.reset();
        List<Aggregation> distinct = distinctOutnames(aggregations);

        List<String> nonNumeric = nonNumericColumns(table, distinct);
        if (!nonNumeric.isEmpty()) {
            log.debug("Numeric aggregation requested on non-numeric columns {}", nonNumeric);
            return GroupByResult.failure(Messages.nonNumericColumns(nonNumeric));
        }

        Table input = table.select(neededColumns(table, groups, distinct));
        List<Column> keys = GroupByProfiler.time(Phase.NORMALIZE, () -> normalizeKeys(input, groups));
        SortedGroups sorted = GroupByProfiler.time(
            Phase.SORT,
            () -> GroupSplitDetector.detect(Table.of(input.rowCount(), keys), input, nullKeyPolicy)
        );
        List<Column> aggregates = GroupByProfiler.time(Phase.REDUCE, () -> reduceAll(sorted, distinct));

        Table output = OutputAssembler.assemble(sorted, aggregates);
        log.debug("Grouped {} rows by {} into {} groups with {} aggregations",
            table.rowCount(), keys.size(), output.rowCount(), aggregates.size());
        if (GroupByProfiler.isEnabled()) {
            log.debug("Profile: {}", GroupByProfiler.summary());
        }
        return GroupByResult.success(output);
    }

    private static List<Column> normalizeKeys(Table input, List<Group> groups) {
        List<Column> keys = new ArrayList<>(groups.size());
        for (Group group : groups) {
            keys.add(GroupKeyNormalizer.normalize(input.column(group.colname()), group.granularity()));
        }
        return keys;
    }

    private static List<Column> reduceAll(SortedGroups sorted, List<Aggregation> aggregations) {
        List<Column> aggregates = new ArrayList<>(aggregations.size());
        for (Aggregation aggregation : aggregations) {
            Column source = aggregation.operation().needsColumn()
                ? sorted.sortedInput().column(aggregation.colname())
                : null;
            Column reduced = GroupReducer.reduce(aggregation, source, sorted);
            String format = OutputAssembler.outputFormat(aggregation.operation(), source == null ? null : source.format());
            aggregates.add(reduced.withFormat(format));
        }
        return aggregates;
    }

    /**
     * Keeps the first aggregation of each outname, in input order.
     */
    static List<Aggregation> distinctOutnames(List<Aggregation> aggregations) {
        Map<String, Aggregation> byOutname = new LinkedHashMap<>();
        for (Aggregation aggregation : aggregations) {
            byOutname.putIfAbsent(aggregation.outname(), aggregation);
        }
        return new ArrayList<>(byOutname.values());
    }

    private static List<String> nonNumericColumns(Table table, List<Aggregation> aggregations) {
        Set<String> offending = new LinkedHashSet<>();
        for (Aggregation aggregation : aggregations) {
            if (aggregation.operation().needsNumericColumn()
                && !table.column(aggregation.colname()).type().isNumeric()) {
                offending.add(aggregation.colname());
            }
        }
        return new ArrayList<>(offending);
    }

    /**
     * Names of the columns read by groups or aggregations, in table order.
     */
    private static List<String> neededColumns(Table table, List<Group> groups, List<Aggregation> aggregations) {
        Set<String> needed = new HashSet<>();
        for (Group group : groups) {
            needed.add(group.colname());
        }
        for (Aggregation aggregation : aggregations) {
            if (aggregation.operation().needsColumn()) {
                needed.add(aggregation.colname());
            }
        }
        List<String> ordered = new ArrayList<>(needed.size());
        for (String name : table.columnNames()) {
            if (needed.remove(name)) {
                ordered.add(name);
            }
        }
        if (!needed.isEmpty()) {
            throw new IllegalArgumentException("Unknown columns " + needed + ", table has " + table.columnNames());
        }
        return ordered;
    }
}
