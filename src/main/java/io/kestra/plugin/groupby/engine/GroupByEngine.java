package io.kestra.plugin.groupby.engine;

import io.kestra.plugin.groupby.model.Aggregation;
import io.kestra.plugin.groupby.model.Group;
import io.kestra.plugin.groupby.table.Table;

import java.util.List;

public interface GroupByEngine {
    GroupByResult execute(Table table, List<Group> groups, List<Aggregation> aggregations);
}
