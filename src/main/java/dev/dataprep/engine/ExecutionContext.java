package dev.dataprep.engine;

import dev.dataprep.error.RecipeCycleException;
import dev.dataprep.model.Recipe;
import dev.dataprep.plan.LazyPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * What a step may see while it runs: the registered datasets, the recipes of the project, and a
 * way to get another dataset with its own recipe applied.
 *
 * <p>Each context carries the chain of dataset names being resolved. Referencing a dataset that
 * is already on the chain, or going deeper than the configured depth, fails with
 * {@link RecipeCycleException}.
 */
public final class ExecutionContext {

    private final DatasetView datasets;
    private final Map<String, Recipe> projectRecipes;
    private final RecipeApplier applier;
    private final List<String> chain;
    private final int maxDepth;

    ExecutionContext(
        DatasetView datasets,
        Map<String, Recipe> projectRecipes,
        RecipeApplier applier,
        List<String> chain,
        int maxDepth
    ) {
        this.datasets = datasets;
        this.projectRecipes = projectRecipes == null ? Map.of() : Map.copyOf(projectRecipes);
        this.applier = applier;
        this.chain = List.copyOf(chain);
        this.maxDepth = maxDepth;
    }

    public DatasetView datasets() {
        return datasets;
    }

    public Map<String, Recipe> projectRecipes() {
        return projectRecipes;
    }

    /** Dataset names currently being resolved, outermost first. */
    public List<String> chain() {
        return chain;
    }

    public LazyPlan applyRecipe(LazyPlan plan, Recipe recipe) {
        return applier.apply(plan, recipe, this);
    }

    /**
     * The named dataset's combined plan with its project recipe applied.
     *
     * @throws dev.dataprep.error.DatasetNotFoundException when no such dataset is registered
     * @throws RecipeCycleException on a cyclic reference or excessive nesting
     */
    public LazyPlan transformedView(String datasetName) {
        var next = new ArrayList<>(chain);
        next.add(datasetName);
        if (chain.contains(datasetName)) {
            throw new RecipeCycleException("Cyclic dataset reference", next);
        }
        if (chain.size() >= maxDepth) {
            throw new RecipeCycleException("Dataset references nested deeper than " + maxDepth, next);
        }
        Dataset dataset = datasets.require(datasetName);
        Recipe recipe = projectRecipes.getOrDefault(datasetName, Recipe.empty());
        var child = new ExecutionContext(datasets, projectRecipes, applier, next, maxDepth);
        return applier.apply(dataset.plan().combined(), recipe, child);
    }
}
