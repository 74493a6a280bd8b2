package dev.dataprep.engine;

import dev.dataprep.error.InvalidStepParamsException;
import dev.dataprep.error.RecipeCycleException;
import dev.dataprep.error.StepExecutionException;
import dev.dataprep.error.UnknownStepTypeException;
import dev.dataprep.model.EngineConfig;
import dev.dataprep.model.Recipe;
import dev.dataprep.model.Step;
import dev.dataprep.plan.DatasetPlan;
import dev.dataprep.plan.Frame;
import dev.dataprep.plan.LazyPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Folds recipes over dataset plans. Nothing here reads rows except {@link #preview}, which
 * collects a bounded sample.
 */
public final class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final StepRegistry steps;
    private final DatasetView datasets;
    private final EngineConfig config;

    public ExecutionEngine(StepRegistry steps, DatasetView datasets, EngineConfig config) {
        this.steps = steps;
        this.datasets = datasets;
        this.config = config;
    }

    /**
     * Apply one step.
     *
     * @throws UnknownStepTypeException   when the step type is not registered
     * @throws InvalidStepParamsException when the params do not bind to the step's params type
     */
    public LazyPlan applyStep(LazyPlan plan, Step step, ExecutionContext context) {
        StepDefinition<?> definition = steps.get(step.type())
            .orElseThrow(() -> new UnknownStepTypeException(step.id(), step.type()));
        return invoke(definition, plan, step, context);
    }

    private <P> LazyPlan invoke(StepDefinition<P> definition, LazyPlan plan, Step step, ExecutionContext context) {
        P params;
        try {
            params = definition.bind(step.params());
        } catch (IllegalArgumentException e) {
            throw new InvalidStepParamsException(step.id(), step.type(), ParamsBinder.reason(e), e);
        }
        log.debug("Applying step {} ({})", step.id(), step.type());
        return definition.transform().apply(plan, params, context);
    }

    /** Apply {@code recipe} to a plan that belongs to no registered dataset. */
    public LazyPlan applyRecipe(LazyPlan base, Recipe recipe, Map<String, Recipe> projectRecipes) {
        return applyRecipe(base, recipe, newContext(projectRecipes, List.of()));
    }

    /**
     * Fold the recipe's steps over {@code base} in order. An empty recipe returns {@code base}
     * itself. The first failing step aborts the fold.
     *
     * @throws StepExecutionException naming the failing step
     */
    public LazyPlan applyRecipe(LazyPlan base, Recipe recipe, ExecutionContext context) {
        LazyPlan current = base;
        for (Step step : recipe.steps()) {
            try {
                current = applyStep(current, step, context);
            } catch (UnknownStepTypeException | InvalidStepParamsException | RecipeCycleException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new StepExecutionException(step.id(), step.type(), e);
            }
        }
        return current;
    }

    /**
     * First {@code limit} rows of the dataset with {@code recipe} applied. The limit is applied
     * before the recipe; in per-file mode only the first source file is previewed.
     */
    public Frame preview(String datasetName, Recipe recipe, Map<String, Recipe> projectRecipes, int limit) {
        Dataset dataset = datasets.require(datasetName);
        LazyPlan base = dataset.plan().previewBase().limit(limit);
        return applyRecipe(base, recipe, newContext(projectRecipes, List.of(datasetName))).collect();
    }

    public Frame preview(String datasetName, Recipe recipe, Map<String, Recipe> projectRecipes) {
        return preview(datasetName, recipe, projectRecipes, config.previewRowLimit());
    }

    /**
     * The plan an export runs: in per-file mode the recipe is applied to every source file
     * separately (each optionally limited first) and the results are concatenated; otherwise the
     * recipe runs once on the combined plan, optionally limited.
     *
     * @param collectionLimit row limit, or null for all rows
     */
    public LazyPlan prepareFull(
        String datasetName, Recipe recipe, Map<String, Recipe> projectRecipes, Long collectionLimit
    ) {
        return prepareFull(datasets, datasetName, recipe, projectRecipes, collectionLimit);
    }

    /**
     * Same as {@link #prepareFull(String, Recipe, Map, Long)}, resolving this dataset and any
     * dataset the recipe joins or concatenates from {@code view}, typically a pinned
     * {@link DatasetSnapshot}.
     */
    public LazyPlan prepareFull(
        DatasetView view, String datasetName, Recipe recipe, Map<String, Recipe> projectRecipes, Long collectionLimit
    ) {
        Dataset dataset = view.require(datasetName);
        ExecutionContext context = newContext(view, projectRecipes, List.of(datasetName));
        if (dataset.plan() instanceof DatasetPlan.PerFile perFile) {
            var transformed = new ArrayList<LazyPlan>(perFile.plans().size());
            for (LazyPlan source : perFile.plans()) {
                LazyPlan base = collectionLimit == null ? source : source.limit(collectionLimit);
                transformed.add(applyRecipe(base, recipe, context));
            }
            log.debug("Prepared {} per-file plans for {}", transformed.size(), datasetName);
            return LazyPlan.concatDiagonal(transformed);
        }
        LazyPlan base = dataset.plan().combined();
        if (collectionLimit != null) {
            base = base.limit(collectionLimit);
        }
        return applyRecipe(base, recipe, context);
    }

    /** Column names after {@code recipe}, without reading any rows. */
    public List<String> transformedSchema(String datasetName, Recipe recipe, Map<String, Recipe> projectRecipes) {
        Dataset dataset = datasets.require(datasetName);
        return applyRecipe(dataset.plan().previewBase(), recipe, newContext(projectRecipes, List.of(datasetName)))
            .columnNames();
    }

    ExecutionContext newContext(Map<String, Recipe> projectRecipes, List<String> chain) {
        return newContext(datasets, projectRecipes, chain);
    }

    private ExecutionContext newContext(DatasetView view, Map<String, Recipe> projectRecipes, List<String> chain) {
        return new ExecutionContext(view, projectRecipes, this::applyRecipe, chain, config.maxRecipeDepth());
    }
}
