package dev.dataprep.plan;

import java.util.List;
import java.util.Map;

/**
 * Materialised rows of a {@link LazyPlan}. Each row maps every column name to its value
 * (null when absent).
 */
public record Frame(List<String> columns, List<Map<String, Object>> rows) {

    public Frame {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public Map<String, Object> row(int index) {
        return rows.get(index);
    }

    /** Values of one column in row order. Nulls are kept. */
    public List<Object> column(String name) {
        if (!columns.contains(name)) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return rows.stream().map(r -> r.get(name)).toList();
    }
}
