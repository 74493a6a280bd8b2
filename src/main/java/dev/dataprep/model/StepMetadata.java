package dev.dataprep.model;

/**
 * Display information for a registered step type.
 */
public record StepMetadata(String label, String group) {

    public static StepMetadata of(String label, String group) {
        return new StepMetadata(label, group == null ? "Misc" : group);
    }
}
