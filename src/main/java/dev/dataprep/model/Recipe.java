package dev.dataprep.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered list of steps applied to one dataset. An empty recipe is valid and is a no-op.
 */
public record Recipe(List<Step> steps) {

    public Recipe {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static Recipe empty() {
        return new Recipe(List.of());
    }

    public static Recipe of(Step... steps) {
        return new Recipe(List.of(steps));
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }

    public Recipe withStep(Step step) {
        var copy = new ArrayList<>(steps);
        copy.add(step);
        return new Recipe(copy);
    }

    public Recipe withoutStep(String stepId) {
        return new Recipe(steps.stream().filter(s -> !s.id().equals(stepId)).toList());
    }
}
