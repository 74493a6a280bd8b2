package dev.dataprep.error;

/**
 * Thrown when a step's params do not bind to the parameter type registered for its step type.
 * Not retryable: the recipe itself has to change.
 */
public class InvalidStepParamsException extends DataPrepException {

    private final String stepId;
    private final String stepType;

    public InvalidStepParamsException(String stepId, String stepType, String reason, Throwable cause) {
        super("Parameters invalid for step %s (%s): %s".formatted(stepId, stepType, reason), cause);
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
