package com.fintech.candlesync.indicator;

import com.fintech.candlesync.domain.Candle;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Closed set of indicator formulas, dispatched by the configured {@code type} name.
 *
 * <p>Each kind knows its parameters and defaults, the history length it needs before
 * its output is meaningful, the names it writes, and how to compute them from a history
 * ordered oldest first. Computation writes into {@code out} only when every output of the
 * kind is available, so a kind never contributes a partial result.
 */
public enum IndicatorKind {

    SMA {
        @Override
        public int defaultWarmUp(Map<String, Integer> params) {
            return period(params, 20);
        }

        @Override
        public List<String> outputNames(String name) {
            return List.of(name);
        }

        @Override
        void compute(String name, Map<String, Integer> params, List<Candle> history, Map<String, Double> out) {
            putIfFinite(out, name, IndicatorMath.sma(IndicatorMath.closes(history), period(params, 20)));
        }
    },

    EMA {
        @Override
        public int defaultWarmUp(Map<String, Integer> params) {
            return 4 * period(params, 20);
        }

        @Override
        public List<String> outputNames(String name) {
            return List.of(name);
        }

        @Override
        void compute(String name, Map<String, Integer> params, List<Candle> history, Map<String, Double> out) {
            putIfFinite(out, name, IndicatorMath.ema(IndicatorMath.closes(history), period(params, 20)));
        }
    },

    WMA {
        @Override
        public int defaultWarmUp(Map<String, Integer> params) {
            return period(params, 20);
        }

        @Override
        public List<String> outputNames(String name) {
            return List.of(name);
        }

        @Override
        void compute(String name, Map<String, Integer> params, List<Candle> history, Map<String, Double> out) {
            putIfFinite(out, name, IndicatorMath.wma(IndicatorMath.closes(history), period(params, 20)));
        }
    },

    RSI {
        @Override
        public int defaultWarmUp(Map<String, Integer> params) {
            return period(params, 14) + 1;
        }

        @Override
        public List<String> outputNames(String name) {
            return List.of(name);
        }

        @Override
        void compute(String name, Map<String, Integer> params, List<Candle> history, Map<String, Double> out) {
            putIfFinite(out, name, IndicatorMath.rsi(IndicatorMath.closes(history), period(params, 14)));
        }
    },

    MACD {
        @Override
        public int defaultWarmUp(Map<String, Integer> params) {
            return param(params, "slow", 26) + param(params, "signal", 9) - 1;
        }

        @Override
        public List<String> outputNames(String name) {
            return List.of(name, name + "_signal", name + "_histogram");
        }

        @Override
        void validate(Map<String, Integer> params) {
            super.validate(params);
            if (param(params, "fast", 12) >= param(params, "slow", 26)) {
                throw new IllegalArgumentException("MACD fast period must be below slow period: " + params);
            }
        }

        @Override
        void compute(String name, Map<String, Integer> params, List<Candle> history, Map<String, Double> out) {
            double[] result = IndicatorMath.macd(IndicatorMath.closes(history),
                param(params, "fast", 12), param(params, "slow", 26), param(params, "signal", 9));
            putAll(out, outputNames(name), result);
        }
    },

    STOCHASTIC {
        @Override
        public int defaultWarmUp(Map<String, Integer> params) {
            return param(params, "kPeriod", 14) + param(params, "kSlow", 3) + param(params, "dPeriod", 3) - 2;
        }

        @Override
        public List<String> outputNames(String name) {
            return List.of(name + "_K", name + "_D");
        }

        @Override
        void compute(String name, Map<String, Integer> params, List<Candle> history, Map<String, Double> out) {
            double[] result = IndicatorMath.stochastic(
                IndicatorMath.highs(history), IndicatorMath.lows(history), IndicatorMath.closes(history),
                param(params, "kPeriod", 14), param(params, "kSlow", 3), param(params, "dPeriod", 3));
            putAll(out, outputNames(name), result);
        }
    };

    /** Minimum history length for converged output with the given parameters. */
    public abstract int defaultWarmUp(Map<String, Integer> params);

    /** Names written for an indicator configured under {@code name}. */
    public abstract List<String> outputNames(String name);

    abstract void compute(String name, Map<String, Integer> params, List<Candle> history, Map<String, Double> out);

    void validate(Map<String, Integer> params) {
        params.forEach((key, value) -> {
            if (value == null || value < 1) {
                throw new IllegalArgumentException(name() + " parameter '" + key + "' must be positive, got " + value);
            }
        });
    }

    /**
     * Resolves a configured type name, case-insensitively. "STOCH" is accepted for {@link #STOCHASTIC}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static IndicatorKind fromName(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Indicator type cannot be blank");
        }
        String normalized = type.trim().toUpperCase();
        if ("STOCH".equals(normalized)) {
            return STOCHASTIC;
        }
        return Arrays.stream(values())
            .filter(kind -> kind.name().equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown indicator type: " + type + ". Must be one of: " + Arrays.toString(values())));
    }

    static int param(Map<String, Integer> params, String key, int defaultValue) {
        Integer value = params.get(key);
        return value != null ? value : defaultValue;
    }

    private static int period(Map<String, Integer> params, int defaultValue) {
        return param(params, "period", defaultValue);
    }

    private static void putIfFinite(Map<String, Double> out, String name, double value) {
        if (Double.isFinite(value)) {
            out.put(name, value);
        }
    }

    private static void putAll(Map<String, Double> out, List<String> names, double[] values) {
        if (values == null) {
            return;
        }
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return;
            }
        }
        for (int i = 0; i < names.size(); i++) {
            out.put(names.get(i), values[i]);
        }
    }
}
