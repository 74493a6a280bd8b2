package dev.dataprep.engine;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Binds a free-form params map onto a typed params record. Unknown keys, wrong value types and
 * checks in the record's constructor all fail the bind.
 */
public final class ParamsBinder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private ParamsBinder() {}

    public static <P> P bind(Map<String, Object> params, Class<P> type) {
        return MAPPER.convertValue(params == null ? Map.of() : params, type);
    }

    /** One-line reason for a bind failure, taken from the innermost cause. */
    public static String reason(Throwable failure) {
        Throwable t = failure;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        String message = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
