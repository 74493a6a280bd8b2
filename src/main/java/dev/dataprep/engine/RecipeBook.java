package dev.dataprep.engine;

import dev.dataprep.model.Recipe;
import dev.dataprep.model.Step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The recipes of a project, one per dataset name. Recipes are immutable; edits replace them.
 */
public final class RecipeBook {

    private final Map<String, Recipe> recipes = new LinkedHashMap<>();

    public synchronized void put(String datasetName, Recipe recipe) {
        recipes.put(datasetName, recipe == null ? Recipe.empty() : recipe);
    }

    public synchronized void putAll(Map<String, Recipe> project) {
        project.forEach(this::put);
    }

    /** The dataset's recipe, or an empty recipe. */
    public synchronized Recipe get(String datasetName) {
        return recipes.getOrDefault(datasetName, Recipe.empty());
    }

    public synchronized Recipe addStep(String datasetName, Step step) {
        Recipe updated = get(datasetName).withStep(step);
        recipes.put(datasetName, updated);
        return updated;
    }

    /** @return true when a step with that id was removed */
    public synchronized boolean removeStep(String datasetName, String stepId) {
        Recipe current = get(datasetName);
        Recipe updated = current.withoutStep(stepId);
        if (updated.size() == current.size()) {
            return false;
        }
        recipes.put(datasetName, updated);
        return true;
    }

    public synchronized void clear(String datasetName) {
        recipes.put(datasetName, Recipe.empty());
    }

    public synchronized boolean remove(String datasetName) {
        return recipes.remove(datasetName) != null;
    }

    public synchronized boolean rename(String oldName, String newName) {
        if (!recipes.containsKey(oldName) || recipes.containsKey(newName)) {
            return false;
        }
        recipes.put(newName, recipes.remove(oldName));
        return true;
    }

    /** Point-in-time copy, in insertion order. */
    public synchronized Map<String, Recipe> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(recipes));
    }
}
