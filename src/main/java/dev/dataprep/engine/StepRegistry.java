package dev.dataprep.engine;

import dev.dataprep.model.StepMetadata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Step types known to one engine, in registration order.
 */
public final class StepRegistry {

    private final Map<String, StepDefinition<?>> steps = new LinkedHashMap<>();

    /**
     * Register a step type. An existing registration under the same type wins.
     *
     * @return true when the type was added
     */
    public synchronized <P> boolean register(
        String type, StepMetadata metadata, Class<P> paramsType, StepTransform<P> transform
    ) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Step type must not be blank");
        }
        if (steps.containsKey(type)) {
            return false;
        }
        steps.put(type, new StepDefinition<>(type, metadata, paramsType, transform));
        return true;
    }

    public synchronized Optional<StepDefinition<?>> get(String type) {
        return Optional.ofNullable(steps.get(type));
    }

    public synchronized List<String> listTypes() {
        return List.copyOf(steps.keySet());
    }

    public synchronized List<StepDefinition<?>> definitions() {
        return List.copyOf(steps.values());
    }

    public synchronized boolean isEmpty() {
        return steps.isEmpty();
    }
}
