package dev.dataprep.io;

import dev.dataprep.model.FilterDescriptor;

import java.util.List;

/**
 * What to load and how.
 *
 * @param basePath             file, directory or glob pattern
 * @param filters              filters every file must satisfy
 * @param fileLimit            maximum number of files, or null
 * @param perFile              keep each file as its own plan
 * @param includeSourceColumns add source path/name/extension columns
 * @param delimiter            CSV delimiter, or null to pick one from the extension
 */
public record LoadRequest(
    String basePath,
    List<FilterDescriptor> filters,
    Integer fileLimit,
    boolean perFile,
    boolean includeSourceColumns,
    Character delimiter
) {
    public LoadRequest {
        if (basePath == null || basePath.isBlank()) {
            throw new IllegalArgumentException("basePath must not be blank");
        }
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public static LoadRequest of(String basePath) {
        return new LoadRequest(basePath, List.of(), null, false, false, null);
    }

    public LoadRequest withFilters(List<FilterDescriptor> filters) {
        return new LoadRequest(basePath, filters, fileLimit, perFile, includeSourceColumns, delimiter);
    }

    public LoadRequest withFileLimit(Integer limit) {
        return new LoadRequest(basePath, filters, limit, perFile, includeSourceColumns, delimiter);
    }

    public LoadRequest perFile(boolean enabled) {
        return new LoadRequest(basePath, filters, fileLimit, enabled, includeSourceColumns, delimiter);
    }

    public LoadRequest withSourceColumns(boolean enabled) {
        return new LoadRequest(basePath, filters, fileLimit, perFile, enabled, delimiter);
    }
}
