package dev.dataprep.engine;

import dev.dataprep.model.StepMetadata;

import java.util.Map;

/**
 * A registered step type: its display metadata, the record its params bind to, and its transform.
 */
public record StepDefinition<P>(
    String type,
    StepMetadata metadata,
    Class<P> paramsType,
    StepTransform<P> transform
) {
    /** @throws IllegalArgumentException when the params do not bind to {@link #paramsType()} */
    public P bind(Map<String, Object> params) {
        return ParamsBinder.bind(params, paramsType);
    }
}
