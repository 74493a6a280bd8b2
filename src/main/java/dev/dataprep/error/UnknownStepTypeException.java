package dev.dataprep.error;

/**
 * Thrown when a recipe step names a type that is not in the step registry.
 */
public class UnknownStepTypeException extends DataPrepException {

    private final String stepId;
    private final String stepType;

    public UnknownStepTypeException(String stepId, String stepType) {
        super("Unknown step type '%s' (step %s)".formatted(stepType, stepId));
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
