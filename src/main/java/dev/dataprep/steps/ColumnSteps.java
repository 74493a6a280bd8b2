package dev.dataprep.steps;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.dataprep.engine.ExecutionContext;
import dev.dataprep.plan.LazyPlan;

import java.util.List;
import java.util.Map;

/**
 * Steps that change which columns a dataset has.
 */
public final class ColumnSteps {

    private ColumnSteps() {}

    public record SelectColsParams(List<String> cols) {
        public SelectColsParams {
            if (cols == null || cols.isEmpty()) {
                throw new IllegalArgumentException("cols must name at least one column");
            }
            cols = List.copyOf(cols);
        }
    }

    public record DropColsParams(List<String> cols) {
        public DropColsParams {
            cols = cols == null ? List.of() : List.copyOf(cols);
        }
    }

    public record RenameColParams(
        @JsonProperty("old") String oldName,
        @JsonProperty("new") String newName
    ) {
        public RenameColParams {
            if (oldName == null || oldName.isBlank() || newName == null || newName.isBlank()) {
                throw new IllegalArgumentException("old and new column names must not be blank");
            }
        }
    }

    static LazyPlan select(LazyPlan plan, SelectColsParams params, ExecutionContext context) {
        return plan.select(params.cols());
    }

    static LazyPlan drop(LazyPlan plan, DropColsParams params, ExecutionContext context) {
        if (params.cols().isEmpty()) {
            return plan;
        }
        return plan.drop(params.cols());
    }

    static LazyPlan rename(LazyPlan plan, RenameColParams params, ExecutionContext context) {
        if (params.oldName().equals(params.newName())) {
            plan.requireColumns(List.of(params.oldName()));
            return plan;
        }
        return plan.rename(Map.of(params.oldName(), params.newName()));
    }
}
