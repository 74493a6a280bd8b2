package dev.dataprep.engine;

import dev.dataprep.model.Recipe;
import dev.dataprep.plan.LazyPlan;

/** Applies a recipe to a plan; handed to steps so they can transform other datasets. */
@FunctionalInterface
public interface RecipeApplier {

    LazyPlan apply(LazyPlan plan, Recipe recipe, ExecutionContext context);
}
