package com.fintech.candlesync.domain;

import java.io.Serializable;
import java.util.Optional;

/**
 * Immutable OHLCV bar for one bucket of a series.
 * The owning (source, instrument, timeframe) lives in {@link SeriesKey}.
 *
 * @param bucketStart Bucket start timestamp (epoch-aligned millis)
 * @param open First price in bucket
 * @param high Maximum price
 * @param low Minimum price
 * @param close Last price in bucket
 * @param baseVolume Volume in base asset units
 * @param quoteVolume Volume in quote asset units
 * @param tradeCount Number of trades aggregated
 * @param synthetic True for gap-filled bars never written by real trades
 */
public record Candle(
    long bucketStart,
    double open,
    double high,
    double low,
    double close,
    double baseVolume,
    double quoteVolume,
    long tradeCount,
    boolean synthetic
) implements Serializable {

    /**
     * Creates a synthetic flat bar carrying the previous close forward.
     */
    public static Candle syntheticFlat(long bucketStart, double price) {
        return new Candle(bucketStart, price, price, price, price, 0.0, 0.0, 0L, true);
    }

    /**
     * Returns a description of the first failed sanity check, or empty if the bar is well formed.
     * Checks: finite positive prices, high >= low, open/close inside [low, high],
     * non-negative volumes and trade count.
     */
    public Optional<String> sanityViolation() {
        if (!Double.isFinite(open) || !Double.isFinite(high) || !Double.isFinite(low) || !Double.isFinite(close)) {
            return Optional.of("non-finite price");
        }
        if (open <= 0 || high <= 0 || low <= 0 || close <= 0) {
            return Optional.of("non-positive price");
        }
        if (high < low) {
            return Optional.of("high (" + high + ") < low (" + low + ")");
        }
        if (open > high || open < low) {
            return Optional.of("open (" + open + ") outside [" + low + ", " + high + "]");
        }
        if (close > high || close < low) {
            return Optional.of("close (" + close + ") outside [" + low + ", " + high + "]");
        }
        if (!Double.isFinite(baseVolume) || baseVolume < 0 || !Double.isFinite(quoteVolume) || quoteVolume < 0) {
            return Optional.of("negative or non-finite volume");
        }
        if (tradeCount < 0) {
            return Optional.of("negative trade count");
        }
        return Optional.empty();
    }
}
