package com.fintech.candlesync.indicator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One configured indicator: the name it is stored under, its formula, parameters and warm-up length.
 *
 * @param name Base output name, e.g. "SMA_20"
 * @param kind Formula to apply
 * @param params Integer parameters such as period; missing ones take the kind's defaults
 * @param warmUp Minimum history length before the indicator is evaluated
 */
public record IndicatorDefinition(
    String name,
    IndicatorKind kind,
    Map<String, Integer> params,
    int warmUp
) {

    public IndicatorDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Indicator name cannot be blank");
        }
        Objects.requireNonNull(kind, "Indicator kind cannot be null");
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params == null ? Map.of() : params));
        kind.validate(params);
        if (warmUp < 1) {
            throw new IllegalArgumentException("Warm-up for " + name + " must be positive, got " + warmUp);
        }
    }

    /** Creates a definition using the kind's default warm-up for the given parameters. */
    public static IndicatorDefinition of(String name, IndicatorKind kind, Map<String, Integer> params) {
        Map<String, Integer> safe = params == null ? Map.of() : params;
        return new IndicatorDefinition(name, kind, safe, kind.defaultWarmUp(safe));
    }

    public List<String> outputNames() {
        return kind.outputNames(name);
    }
}
