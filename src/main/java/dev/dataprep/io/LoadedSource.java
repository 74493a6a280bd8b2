package dev.dataprep.io;

import dev.dataprep.model.LoadMetadata;
import dev.dataprep.plan.DatasetPlan;

import java.util.List;

/** Result of a load, ready to be registered as a dataset. */
public record LoadedSource(DatasetPlan plan, LoadMetadata metadata, List<StagedFile> stagedFiles) {

    public LoadedSource {
        stagedFiles = stagedFiles == null ? List.of() : List.copyOf(stagedFiles);
    }
}
