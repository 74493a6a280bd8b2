package dev.dataprep.engine;

import dev.dataprep.model.Recipe;
import dev.dataprep.model.Step;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Checks a recipe against a step registry before it runs.
 */
public final class RecipeValidator {

    private RecipeValidator() {}

    /**
     * Returns an empty list if the recipe is valid, otherwise one message per problem.
     */
    public static List<String> validate(Recipe recipe, StepRegistry registry) {
        var errors = new ArrayList<String>();
        var seen = new HashSet<String>();

        for (int i = 0; i < recipe.size(); i++) {
            Step step = recipe.steps().get(i);

            if (step.id() == null || step.id().isBlank()) {
                errors.add("Step at index %d has a blank id".formatted(i));
            } else if (!seen.add(step.id())) {
                errors.add("Duplicate step id '%s'".formatted(step.id()));
            }

            var definition = registry.get(step.type());
            if (definition.isEmpty()) {
                errors.add("Step '%s': unknown step type '%s'".formatted(step.id(), step.type()));
                continue;
            }

            try {
                definition.get().bind(step.params());
            } catch (IllegalArgumentException e) {
                errors.add("Step '%s' (%s): invalid params: %s"
                    .formatted(step.id(), step.type(), ParamsBinder.reason(e)));
            }
        }

        return errors;
    }
}
