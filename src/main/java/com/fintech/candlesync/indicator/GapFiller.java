package com.fintech.candlesync.indicator;

import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.Timeframe;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects and forward-fills missing buckets in a candle history.
 *
 * Filled bars are flat at the previous close with zero volume and {@code synthetic = true}.
 * They only exist in memory for evaluation and are never written back.
 */
public final class GapFiller {

    private GapFiller() {
    }

    /** Number of missing buckets between the first and last candle. */
    public static int countMissing(List<Candle> history, Timeframe timeframe) {
        int missing = 0;
        for (int i = 1; i < history.size(); i++) {
            long step = history.get(i).bucketStart() - history.get(i - 1).bucketStart();
            missing += (int) (step / timeframe.toMillis()) - 1;
        }
        return Math.max(missing, 0);
    }

    /**
     * Returns a contiguous history from the first to the last candle.
     * Leading gaps before the first candle are never invented.
     */
    public static List<Candle> fill(List<Candle> history, Timeframe timeframe) {
        if (history.size() < 2) {
            return history;
        }
        List<Candle> filled = new ArrayList<>(history.size());
        Candle previous = null;
        for (Candle candle : history) {
            if (previous != null) {
                for (long bucket = timeframe.shift(previous.bucketStart(), 1);
                     bucket < candle.bucketStart();
                     bucket = timeframe.shift(bucket, 1)) {
                    filled.add(Candle.syntheticFlat(bucket, previous.close()));
                }
            }
            filled.add(candle);
            previous = candle;
        }
        return filled;
    }

    /** Share of synthetic candles in the window, 0 for an empty window. */
    public static double syntheticRatio(List<Candle> window) {
        if (window.isEmpty()) {
            return 0.0;
        }
        long synthetic = window.stream().filter(Candle::synthetic).count();
        return (double) synthetic / window.size();
    }
}
