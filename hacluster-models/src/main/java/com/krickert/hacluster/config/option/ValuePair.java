package com.krickert.hacluster.config.option;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An option value as the user typed it together with its normalized form. Validators check the
 * normalized value and report the original one. A null or "" normalized value means "unset".
 */
public record ValuePair(String original, String normalized) {

    public static ValuePair of(String value) {
        return new ValuePair(value, value);
    }

    public boolean isEmpty() {
        return normalized == null || normalized.isEmpty();
    }

    /**
     * Wraps plain string options, keeping their order. Null values are kept as empty pairs.
     */
    public static Map<String, ValuePair> wrap(Map<String, String> options) {
        Map<String, ValuePair> wrapped = new LinkedHashMap<>();
        if (options != null) {
            options.forEach((name, value) -> wrapped.put(name, ValuePair.of(value)));
        }
        return wrapped;
    }
}
