package dev.dataprep.steps;

import dev.dataprep.engine.StepRegistry;
import dev.dataprep.model.StepMetadata;

/**
 * The step types every engine starts with.
 */
public final class BuiltinSteps {

    private BuiltinSteps() {}

    /** Register the built-in steps. Does nothing if the registry already has entries. */
    public static void registerAll(StepRegistry registry) {
        if (!registry.isEmpty()) {
            return;
        }
        registry.register("select_cols", StepMetadata.of("Select Columns", "Columns"),
            ColumnSteps.SelectColsParams.class, ColumnSteps::select);
        registry.register("drop_cols", StepMetadata.of("Drop Columns", "Columns"),
            ColumnSteps.DropColsParams.class, ColumnSteps::drop);
        registry.register("rename_col", StepMetadata.of("Rename Column", "Columns"),
            ColumnSteps.RenameColParams.class, ColumnSteps::rename);

        registry.register("filter_rows", StepMetadata.of("Filter Rows", "Rows"),
            RowSteps.FilterRowsParams.class, RowSteps::filter);
        registry.register("sort_rows", StepMetadata.of("Sort Rows", "Rows"),
            RowSteps.SortRowsParams.class, RowSteps::sort);
        registry.register("deduplicate", StepMetadata.of("Deduplicate", "Rows"),
            RowSteps.DeduplicateParams.class, RowSteps::deduplicate);
        registry.register("slice_rows", StepMetadata.of("Slice Rows", "Rows"),
            RowSteps.SliceRowsParams.class, RowSteps::slice);

        registry.register("join_dataset", StepMetadata.of("Join Dataset", "Combine"),
            CombineSteps.JoinDatasetParams.class, CombineSteps::join);
        registry.register("concat_datasets", StepMetadata.of("Concat Datasets", "Combine"),
            CombineSteps.ConcatParams.class, CombineSteps::concat);
    }
}
