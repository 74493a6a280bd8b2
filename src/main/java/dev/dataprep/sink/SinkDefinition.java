package dev.dataprep.sink;

import dev.dataprep.engine.ParamsBinder;

import java.util.Map;

public record SinkDefinition<P>(String type, Class<P> paramsType, SinkWriter<P> writer) {

    /** @throws IllegalArgumentException when the params do not bind */
    PreparedSink<P> prepare(Map<String, Object> params) {
        return new PreparedSink<>(type, ParamsBinder.bind(params, paramsType), writer);
    }
}
