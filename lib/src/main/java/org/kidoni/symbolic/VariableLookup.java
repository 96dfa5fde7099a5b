package org.kidoni.symbolic;

import java.util.Map;
import java.util.Objects;

@FunctionalInterface
public interface VariableLookup {
    double valueOf(String name);

    static VariableLookup undefined() {
        return name -> Double.NaN;
    }

    static VariableLookup of(final Map<String, Double> values) {
        return of(values, undefined());
    }

    static VariableLookup of(final Map<String, Double> values, final VariableLookup fallback) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(fallback, "fallback");
        return name -> {
            final Double value = values.get(name);
            return value != null ? value : fallback.valueOf(name);
        };
    }
}
