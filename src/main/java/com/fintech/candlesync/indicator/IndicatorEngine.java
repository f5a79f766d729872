package com.fintech.candlesync.indicator;

import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates the configured indicator set against one in-memory history window.
 *
 * <p>Warm-up is checked per indicator: an indicator whose warm-up exceeds the history
 * length is skipped while the others still produce output. A formula that throws is
 * logged and left out of the result without affecting its siblings.
 */
public class IndicatorEngine {

    private static final Logger log = LoggerFactory.getLogger(IndicatorEngine.class);

    private final List<IndicatorDefinition> definitions;

    public IndicatorEngine(List<IndicatorDefinition> definitions) {
        this.definitions = List.copyOf(definitions);
    }

    /**
     * Computes every indicator whose warm-up is met by {@code history}.
     *
     * @param series Series the history belongs to, for logging
     * @param history Candles ordered oldest first; the last one is the bucket being evaluated
     * @return Immutable map from output name to value, in configuration order
     * @throws IllegalArgumentException if history is empty
     */
    public Map<String, Double> evaluate(SeriesKey series, List<Candle> history) {
        if (history == null || history.isEmpty()) {
            throw new IllegalArgumentException("History for " + series + " must contain at least one candle");
        }
        Map<String, Double> values = new LinkedHashMap<>();
        for (IndicatorDefinition definition : definitions) {
            if (history.size() < definition.warmUp()) {
                if (log.isDebugEnabled()) {
                    log.debug("Insufficient history for {} on {}: have {}, need {}",
                        definition.name(), series, history.size(), definition.warmUp());
                }
                continue;
            }
            try {
                definition.kind().compute(definition.name(), definition.params(), history, values);
            } catch (RuntimeException e) {
                log.error("Indicator {} failed on {} at bucket {}",
                    definition.name(), series, history.get(history.size() - 1).bucketStart(), e);
            }
        }
        return Collections.unmodifiableMap(values);
    }

    public List<IndicatorDefinition> definitions() {
        return definitions;
    }
}
