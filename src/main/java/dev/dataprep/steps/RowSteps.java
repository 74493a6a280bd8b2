package dev.dataprep.steps;

import dev.dataprep.engine.ExecutionContext;
import dev.dataprep.plan.LazyPlan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Steps that keep, drop or reorder rows.
 */
public final class RowSteps {

    static final Set<String> FILTER_OPS = Set.of(
        "==", "!=", ">", ">=", "<", "<=", "contains", "not_contains", "is_null", "is_not_null");

    static final Set<String> SLICE_MODES = Set.of("Keep Top", "Keep Bottom", "Remove Top", "Remove Bottom");

    private RowSteps() {}

    /**
     * One comparison. {@code val} is ignored by the null checks; for the other operators a blank
     * {@code val} disables the condition.
     */
    public record FilterCondition(String col, String op, Object val) {
        public FilterCondition {
            if (col == null || col.isBlank()) {
                throw new IllegalArgumentException("Filter condition needs a column");
            }
            if (op == null || !FILTER_OPS.contains(op)) {
                throw new IllegalArgumentException("Unknown filter operator '%s'; expected one of %s"
                    .formatted(op, FILTER_OPS));
            }
        }

        boolean isActive() {
            return op.equals("is_null") || op.equals("is_not_null")
                || (val != null && !val.toString().isBlank());
        }
    }

    public record FilterRowsParams(String logic, List<FilterCondition> conditions) {
        public FilterRowsParams {
            logic = logic == null ? "AND" : logic.trim().toUpperCase(Locale.ROOT);
            if (!logic.equals("AND") && !logic.equals("OR")) {
                throw new IllegalArgumentException("logic must be AND or OR, got " + logic);
            }
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }
    }

    public record SortRowsParams(List<String> cols, Boolean desc) {
        public SortRowsParams {
            cols = cols == null ? List.of() : List.copyOf(cols);
            desc = desc != null && desc;
        }
    }

    public record DeduplicateParams(List<String> subset) {
        public DeduplicateParams {
            subset = subset == null ? List.of() : List.copyOf(subset);
        }
    }

    public record SliceRowsParams(String mode, Integer n) {
        public SliceRowsParams {
            mode = mode == null ? "Keep Top" : mode;
            if (!SLICE_MODES.contains(mode)) {
                throw new IllegalArgumentException("mode must be one of " + SLICE_MODES);
            }
            n = n == null ? 10 : Math.max(0, n);
        }
    }

    static LazyPlan filter(LazyPlan plan, FilterRowsParams params, ExecutionContext context) {
        List<FilterCondition> active = params.conditions().stream().filter(FilterCondition::isActive).toList();
        if (active.isEmpty()) {
            return plan;
        }
        plan.requireColumns(active.stream().map(FilterCondition::col).toList());

        var predicates = new ArrayList<Predicate<Map<String, Object>>>();
        active.forEach(c -> predicates.add(predicate(c)));
        Predicate<Map<String, Object>> combined = predicates.get(0);
        for (var p : predicates.subList(1, predicates.size())) {
            combined = params.logic().equals("AND") ? combined.and(p) : combined.or(p);
        }
        return plan.filter(combined);
    }

    // A null cell satisfies only is_null.
    private static Predicate<Map<String, Object>> predicate(FilterCondition c) {
        String col = c.col();
        Object val = c.val();
        return switch (c.op()) {
            case "is_null" -> row -> row.get(col) == null;
            case "is_not_null" -> row -> row.get(col) != null;
            case "==" -> row -> row.get(col) != null && Values.equal(row.get(col), val);
            case "!=" -> row -> row.get(col) != null && !Values.equal(row.get(col), val);
            case ">" -> row -> row.get(col) != null && Values.compare(row.get(col), val) > 0;
            case ">=" -> row -> row.get(col) != null && Values.compare(row.get(col), val) >= 0;
            case "<" -> row -> row.get(col) != null && Values.compare(row.get(col), val) < 0;
            case "<=" -> row -> row.get(col) != null && Values.compare(row.get(col), val) <= 0;
            case "contains" -> row -> row.get(col) != null && row.get(col).toString().contains(val.toString());
            case "not_contains" -> row -> row.get(col) != null && !row.get(col).toString().contains(val.toString());
            default -> throw new IllegalArgumentException("Unknown filter operator: " + c.op());
        };
    }

    static LazyPlan sort(LazyPlan plan, SortRowsParams params, ExecutionContext context) {
        if (params.cols().isEmpty()) {
            return plan;
        }
        plan.requireColumns(params.cols());
        Comparator<Map<String, Object>> order = null;
        for (String col : params.cols()) {
            Comparator<Object> values = params.desc()
                ? Comparator.nullsLast(Values.NATURAL_NON_NULL.reversed())
                : Values.NATURAL;
            Comparator<Map<String, Object>> byCol = Comparator.comparing(row -> row.get(col), values);
            order = order == null ? byCol : order.thenComparing(byCol);
        }
        return plan.sort(order);
    }

    static LazyPlan deduplicate(LazyPlan plan, DeduplicateParams params, ExecutionContext context) {
        return plan.distinct(params.subset());
    }

    static LazyPlan slice(LazyPlan plan, SliceRowsParams params, ExecutionContext context) {
        long n = params.n();
        return switch (params.mode()) {
            case "Keep Top" -> plan.limit(n);
            case "Keep Bottom" -> plan.tail(n);
            case "Remove Top" -> plan.skip(n);
            case "Remove Bottom" -> plan.dropLast(n);
            default -> throw new IllegalArgumentException("Unknown slice mode: " + params.mode());
        };
    }
}
