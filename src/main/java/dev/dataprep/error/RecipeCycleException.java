package dev.dataprep.error;

import java.util.List;

/**
 * A dataset's recipe refers, directly or through other datasets, back to itself, or the chain of
 * references is deeper than the configured limit.
 */
public class RecipeCycleException extends DataPrepException {

    private final List<String> chain;

    public RecipeCycleException(String message, List<String> chain) {
        super(message + ": " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
