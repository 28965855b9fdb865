package io.kestra.plugin.groupby;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kestra.plugin.groupby.engine.DefaultGroupByEngine;
import io.kestra.plugin.groupby.engine.GroupByEngine;
import io.kestra.plugin.groupby.engine.GroupByResult;
import io.kestra.plugin.groupby.engine.NullKeyPolicy;
import io.kestra.plugin.groupby.message.Messages;
import io.kestra.plugin.groupby.message.RenderError;
import io.kestra.plugin.groupby.model.Aggregation;
import io.kestra.plugin.groupby.model.DateGranularity;
import io.kestra.plugin.groupby.model.Group;
import io.kestra.plugin.groupby.model.Operation;
import io.kestra.plugin.groupby.table.ColumnType;
import io.kestra.plugin.groupby.table.Table;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Builder
@ToString
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Schema(
    title = "Group rows",
    description = "Group table rows by one or more columns and compute aggregates for each group."
)
public class GroupBy {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Schema(
        title = "Grouping",
        description = "Columns to group on, and how to bucket timestamp columns."
    )
    private GroupsDefinition groups;

    @Schema(
        title = "Aggregations",
        description = "Aggregate columns to compute for each group. Without any, each group's size is computed."
    )
    private List<AggregationDefinition> aggregations;

    @Builder.Default
    @Schema(
        title = "Drop null keys",
        description = "Skip rows where any grouping column is null. When false, null is a group of its own, sorted last."
    )
    private boolean dropNullKeys = true;

    /**
     * Decodes canonical parameters, as found in a flow definition, into a step.
     */
    public static GroupBy fromParams(Map<String, Object> params) throws GroupByException {
        try {
            return MAPPER.convertValue(params, GroupBy.class);
        } catch (IllegalArgumentException e) {
            throw new GroupByException("Invalid group-by parameters: " + e.getMessage(), e);
        }
    }

    public GroupByResult run(Table table) {
        return run(table, new DefaultGroupByEngine(dropNullKeys ? NullKeyPolicy.DROP : NullKeyPolicy.KEEP));
    }

    GroupByResult run(Table table, GroupByEngine engine) {
        List<String> colnames = groups == null || groups.colnames == null ? List.of() : groups.colnames;
        List<Aggregation> resolved = resolveAggregations();
        if (colnames.isEmpty() && resolved.isEmpty()) {
            return GroupByResult.success(table);
        }
        if (resolved.isEmpty()) {
            resolved = List.of(new Aggregation(Operation.SIZE, "", Operation.SIZE.defaultOutname("")));
        }

        boolean groupDates = groups != null && groups.groupDates;
        List<Group> groupList = new ArrayList<>(colnames.size());
        for (String colname : colnames) {
            groupList.add(new Group(colname, granularity(table, colname, groupDates)));
        }

        GroupByResult result = engine.execute(table, groupList, resolved);
        if (!result.isSuccess() || !groupDates || colnames.isEmpty()) {
            return result;
        }
        List<RenderError> advisories = dateAdvisories(table, groupList);
        for (RenderError advisory : advisories) {
            log.warn("Date grouping advisory: {}", advisory.message().id());
        }
        return result.withAdvisories(advisories);
    }

    /**
     * Canonical aggregations: blank column names are skipped, except for {@code size}, and blank outnames get a
     * default name.
     */
    List<Aggregation> resolveAggregations() {
        if (aggregations == null) {
            return List.of();
        }
        List<Aggregation> resolved = new ArrayList<>(aggregations.size());
        for (AggregationDefinition definition : aggregations) {
            if (definition == null || definition.operation == null) {
                continue;
            }
            Operation operation = definition.operation;
            String colname = definition.colname == null ? "" : definition.colname;
            if (operation.needsColumn() && colname.isEmpty()) {
                log.debug("Skipping {} aggregation without a column", operation.id());
                continue;
            }
            String outname = definition.outname == null || definition.outname.isEmpty()
                ? operation.defaultOutname(colname)
                : definition.outname;
            resolved.add(new Aggregation(operation, colname, outname));
        }
        return resolved;
    }

    private DateGranularity granularity(Table table, String colname, boolean groupDates) {
        if (!groupDates || groups.dateGranularities == null) {
            return null;
        }
        DateGranularity granularity = groups.dateGranularities.get(colname);
        if (granularity != null && table.column(colname).type() != ColumnType.TIMESTAMP) {
            log.debug("Ignoring {} granularity on column '{}' of type {}", granularity.unit(), colname,
                table.column(colname).type());
            return null;
        }
        return granularity;
    }

    /**
     * Deprecated granularities first. Without any, nudges the user toward grouping a date column.
     */
    private static List<RenderError> dateAdvisories(Table table, List<Group> groupList) {
        Map<DateGranularity, List<String>> applied = new LinkedHashMap<>();
        for (Group group : groupList) {
            if (group.granularity() != null) {
                applied.computeIfAbsent(group.granularity(), g -> new ArrayList<>()).add(group.colname());
            }
        }
        if (!applied.isEmpty()) {
            List<RenderError> advisories = new ArrayList<>(applied.size());
            for (Map.Entry<DateGranularity, List<String>> entry : applied.entrySet()) {
                advisories.add(Messages.granularityDeprecated(entry.getKey(), entry.getValue()));
            }
            return advisories;
        }

        List<String> timestamps = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        for (Group group : groupList) {
            ColumnType type = table.column(group.colname()).type();
            if (type == ColumnType.DATE) {
                return List.of();
            }
            if (type == ColumnType.TIMESTAMP) {
                timestamps.add(group.colname());
            } else if (type == ColumnType.TEXT) {
                texts.add(group.colname());
            }
        }
        if (!timestamps.isEmpty()) {
            return List.of(Messages.timestampSelected(timestamps));
        }
        if (!texts.isEmpty()) {
            return List.of(Messages.textSelected(texts));
        }
        return List.of(Messages.selectDateColumns());
    }

    @Builder
    @Getter
    @ToString
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GroupsDefinition {
        @Schema(title = "Group columns")
        private List<String> colnames;

        @JsonProperty("group_dates")
        @Schema(
            title = "Group dates",
            description = "Bucket timestamp columns by their date granularity."
        )
        private boolean groupDates;

        @JsonProperty("date_granularities")
        @Schema(
            title = "Date granularities",
            description = "Granularity per timestamp column: second, minute, hour, day, week, month, quarter or year."
        )
        private Map<String, DateGranularity> dateGranularities;
    }

    @Builder
    @Getter
    @ToString
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AggregationDefinition {
        @Schema(title = "Operation")
        private Operation operation;

        @Schema(title = "Source column", description = "Unused by size.")
        private String colname;

        @Schema(title = "Output column name", description = "Defaults to a name derived from the operation and column.")
        private String outname;

        @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
        public static AggregationDefinition from(Object value) {
            if (value == null) {
                return null;
            }
            if (value instanceof String stringValue) {
                return AggregationDefinition.builder().operation(Operation.fromId(stringValue)).build();
            }
            if (value instanceof Map<?, ?> map) {
                Object operationValue = map.get("operation");
                Object colnameValue = map.get("colname");
                Object outnameValue = map.get("outname");
                return AggregationDefinition.builder()
                    .operation(operationValue == null ? null : Operation.fromId(String.valueOf(operationValue)))
                    .colname(colnameValue == null ? null : String.valueOf(colnameValue))
                    .outname(outnameValue == null ? null : String.valueOf(outnameValue))
                    .build();
            }
            throw new IllegalArgumentException("Unsupported aggregation definition: " + value);
        }
    }
}
