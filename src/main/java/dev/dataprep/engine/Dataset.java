package dev.dataprep.engine;

import dev.dataprep.io.StagedFile;
import dev.dataprep.model.LoadMetadata;
import dev.dataprep.plan.DatasetPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * A named dataset: its plan(s), how it was loaded, and the staged files its plans read from.
 */
public record Dataset(
    String name,
    DatasetPlan plan,
    LoadMetadata metadata,
    List<StagedFile> stagedFiles
) {
    private static final Logger log = LoggerFactory.getLogger(Dataset.class);

    public Dataset {
        stagedFiles = stagedFiles == null ? List.of() : List.copyOf(stagedFiles);
        metadata = metadata == null ? LoadMetadata.inMemory() : metadata;
    }

    public boolean isPerFile() {
        return plan instanceof DatasetPlan.PerFile;
    }

    /** Drop this dataset's hold on its staged files. Files pinned by a snapshot stay until it closes. */
    void release() {
        for (StagedFile f : stagedFiles) {
            try {
                f.close();
            } catch (IOException e) {
                log.warn("Failed to release staged file {} of dataset {}: {}", f.path(), name, e.toString());
            }
        }
    }
}
