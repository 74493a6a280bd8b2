package dev.dataprep.sink;

import dev.dataprep.engine.ParamsBinder;
import dev.dataprep.error.InvalidSinkConfigException;
import dev.dataprep.error.UnknownSinkTypeException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sink types known to one engine.
 */
public final class SinkRegistry {

    private final Map<String, SinkDefinition<?>> sinks = new LinkedHashMap<>();

    /** @return true when the type was added; an existing registration wins */
    public synchronized <P> boolean register(String type, Class<P> paramsType, SinkWriter<P> writer) {
        if (sinks.containsKey(type)) {
            return false;
        }
        sinks.put(type, new SinkDefinition<>(type, paramsType, writer));
        return true;
    }

    public synchronized Optional<SinkDefinition<?>> get(String type) {
        return Optional.ofNullable(sinks.get(type));
    }

    public synchronized List<String> listTypes() {
        return List.copyOf(sinks.keySet());
    }

    /**
     * Look up the sink type and bind its params.
     *
     * @throws UnknownSinkTypeException    when the type is not registered
     * @throws InvalidSinkConfigException  when the params do not bind
     */
    public PreparedSink<?> prepare(String type, Map<String, Object> params) {
        SinkDefinition<?> definition = get(type).orElseThrow(() -> new UnknownSinkTypeException(type));
        try {
            return definition.prepare(params);
        } catch (IllegalArgumentException e) {
            throw new InvalidSinkConfigException(type, ParamsBinder.reason(e), e);
        }
    }

    /** Register the csv and ndjson sinks. */
    public static SinkRegistry withBuiltins() {
        var registry = new SinkRegistry();
        registry.register("csv", CsvSink.Params.class, new CsvSink());
        registry.register("ndjson", NdjsonSink.Params.class, new NdjsonSink());
        return registry;
    }
}
