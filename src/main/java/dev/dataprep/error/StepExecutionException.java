package dev.dataprep.error;

/**
 * A transform failed while a recipe was being applied. The fold stops at this step and no plan
 * is returned.
 */
public class StepExecutionException extends DataPrepException {

    private final String stepId;
    private final String stepType;

    public StepExecutionException(String stepId, String stepType, Throwable cause) {
        super("Step %s (%s) failed: %s".formatted(stepId, stepType, cause.getMessage()), cause);
        this.stepId = stepId;
        this.stepType = stepType;
    }

    public String stepId() {
        return stepId;
    }

    public String stepType() {
        return stepType;
    }
}
