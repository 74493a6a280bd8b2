package dev.dataprep.model;

import java.util.List;

/**
 * Structure of a spreadsheet container. {@code valid} is false when the defaults were returned
 * because the file could not be read.
 */
public record WorkbookMetadata(
    List<String> sheetNames,
    List<String> tableNames,
    boolean valid
) {
    public static final String DEFAULT_SHEET = "Sheet1";

    public WorkbookMetadata {
        sheetNames = List.copyOf(sheetNames);
        tableNames = List.copyOf(tableNames);
    }

    public static WorkbookMetadata fallback() {
        return new WorkbookMetadata(List.of(DEFAULT_SHEET), List.of(), false);
    }
}
