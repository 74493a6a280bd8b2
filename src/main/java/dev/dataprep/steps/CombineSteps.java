package dev.dataprep.steps;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.dataprep.engine.ExecutionContext;
import dev.dataprep.plan.JoinType;
import dev.dataprep.plan.LazyPlan;

import java.util.List;
import java.util.Locale;

/**
 * Steps that bring in rows or columns from another registered dataset. The other dataset is read
 * with its own project recipe applied.
 */
public final class CombineSteps {

    private CombineSteps() {}

    /**
     * @param alias   name of the dataset to join with
     * @param how     "inner" or "left"
     * @param leftOn  key columns of this dataset
     * @param rightOn key columns of the other dataset, pairwise with {@code leftOn}
     */
    public record JoinDatasetParams(
        String alias,
        String how,
        @JsonProperty("left_on") List<String> leftOn,
        @JsonProperty("right_on") List<String> rightOn
    ) {
        public JoinDatasetParams {
            if (alias == null || alias.isBlank()) {
                throw new IllegalArgumentException("alias must name a dataset");
            }
            leftOn = leftOn == null ? List.of() : List.copyOf(leftOn);
            rightOn = rightOn == null ? List.of() : List.copyOf(rightOn);
            if (leftOn.isEmpty() || leftOn.size() != rightOn.size()) {
                throw new IllegalArgumentException("left_on and right_on must list the same number of keys");
            }
            try {
                how = JoinType.parse(how).name().toLowerCase(Locale.ROOT);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("how must be inner or left, got " + how);
            }
        }
    }

    public record ConcatParams(@JsonProperty("other_dataset") String otherDataset) {
        public ConcatParams {
            if (otherDataset == null || otherDataset.isBlank()) {
                throw new IllegalArgumentException("other_dataset must name a dataset");
            }
        }
    }

    static LazyPlan join(LazyPlan plan, JoinDatasetParams params, ExecutionContext context) {
        LazyPlan right = context.transformedView(params.alias());
        return plan.join(right, params.leftOn(), params.rightOn(), JoinType.parse(params.how()));
    }

    static LazyPlan concat(LazyPlan plan, ConcatParams params, ExecutionContext context) {
        LazyPlan other = context.transformedView(params.otherDataset());
        return LazyPlan.concatDiagonal(List.of(plan, other));
    }
}
