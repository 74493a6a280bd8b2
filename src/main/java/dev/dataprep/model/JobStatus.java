package dev.dataprep.model;

/**
 * Export job states. RUNNING moves to exactly one of the terminal states.
 */
public enum JobStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
