package dev.dataprep.model;

import java.util.List;

/**
 * How a dataset was loaded.
 *
 * @param sourceKind       "file" for a single source, "folder" for several
 * @param sourcePaths      resolved source files, in load order
 * @param perFileMode      true when each source file is kept as its own plan
 * @param hasSourceColumns true when source path/name/extension columns were added
 * @param inputFormat      lower-case extension of the sources, or ".mixed"
 */
public record LoadMetadata(
    String sourceKind,
    List<String> sourcePaths,
    boolean perFileMode,
    boolean hasSourceColumns,
    String inputFormat
) {
    public LoadMetadata {
        sourcePaths = sourcePaths == null ? List.of() : List.copyOf(sourcePaths);
    }

    public static LoadMetadata inMemory() {
        return new LoadMetadata("memory", List.of(), false, false, null);
    }

    public int fileCount() {
        return sourcePaths.size();
    }
}
