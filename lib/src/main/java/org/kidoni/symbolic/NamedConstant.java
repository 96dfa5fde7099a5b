package org.kidoni.symbolic;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Names the parser resolves to a constant instead of a variable. Matching is exact and case-sensitive.
 */
public enum NamedConstant {
    PI("pi", Math.PI),
    E("e", Math.E),
    LN2("ln2", 0.69314718055994530942),
    LN10("ln10", 2.30258509299404568402),
    SQRT2("sqrt2", 1.41421356237309504880),
    SQRT1_2("sqrt1_2", 0.70710678118654752440),
    DEG2RAD("deg2rad", Math.PI / 180.0),
    RAD2DEG("rad2deg", 180.0 / Math.PI),
    LOG2E("log2e", 1.44269504088896340736),
    LOG10E("log10e", 0.43429448190325182765),
    TWO_PI("two_pi", 2.0 * Math.PI),
    HALF_PI("half_pi", 0.5 * Math.PI);

    private static final Map<String, NamedConstant> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NamedConstant::symbol, Function.identity()));

    private final String symbol;
    private final double value;

    NamedConstant(final String symbol, final double value) {
        this.symbol = symbol;
        this.value = value;
    }

    public String symbol() {
        return symbol;
    }

    public double value() {
        return value;
    }

    public static Optional<NamedConstant> lookup(final String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
