package com.fintech.candlesync.indicator;

import com.fintech.candlesync.domain.Candle;

import java.util.Arrays;
import java.util.List;

/**
 * Pure technical-analysis formulas over price arrays ordered oldest first.
 * Conventions match TA-Lib so stored values line up with the rest of the trading stack:
 * EMA seeded with the SMA of its first period, RSI with Wilder smoothing.
 * Series functions return NaN for indices that are still warming up.
 */
public final class IndicatorMath {

    private IndicatorMath() {
    }

    public static double[] closes(List<Candle> candles) {
        double[] out = new double[candles.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = candles.get(i).close();
        }
        return out;
    }

    public static double[] highs(List<Candle> candles) {
        double[] out = new double[candles.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = candles.get(i).high();
        }
        return out;
    }

    public static double[] lows(List<Candle> candles) {
        double[] out = new double[candles.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = candles.get(i).low();
        }
        return out;
    }

    /** Arithmetic mean of the last {@code period} values. */
    public static double sma(double[] values, int period) {
        requirePeriod(period);
        if (values.length < period) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (int i = values.length - period; i < values.length; i++) {
            sum += values[i];
        }
        return sum / period;
    }

    /** Simple moving average at every index; NaN until {@code period} values are available. */
    public static double[] smaSeries(double[] values, int period) {
        requirePeriod(period);
        double[] out = nanArray(values.length);
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= period) {
                sum -= values[i - period];
            }
            if (i >= period - 1) {
                out[i] = sum / period;
            }
        }
        return out;
    }

    /**
     * Exponential moving average at every index, alpha = 2 / (period + 1).
     * Leading NaNs in the input are skipped; the seed is the SMA of the first period valid values.
     */
    public static double[] emaSeries(double[] values, int period) {
        requirePeriod(period);
        double[] out = nanArray(values.length);
        int start = 0;
        while (start < values.length && Double.isNaN(values[start])) {
            start++;
        }
        int seedIndex = start + period - 1;
        if (seedIndex >= values.length) {
            return out;
        }
        double sum = 0.0;
        for (int i = start; i <= seedIndex; i++) {
            sum += values[i];
        }
        double ema = sum / period;
        out[seedIndex] = ema;
        double alpha = 2.0 / (period + 1);
        for (int i = seedIndex + 1; i < values.length; i++) {
            ema = alpha * values[i] + (1.0 - alpha) * ema;
            out[i] = ema;
        }
        return out;
    }

    public static double ema(double[] values, int period) {
        return last(emaSeries(values, period));
    }

    /** Linearly weighted average of the last {@code period} values, newest weighted highest. */
    public static double wma(double[] values, int period) {
        requirePeriod(period);
        if (values.length < period) {
            return Double.NaN;
        }
        double weighted = 0.0;
        int offset = values.length - period;
        for (int j = 0; j < period; j++) {
            weighted += values[offset + j] * (j + 1);
        }
        return weighted / (period * (period + 1) / 2.0);
    }

    /**
     * Relative strength index with Wilder smoothing.
     * Needs period + 1 closes. Returns 0 when there was no movement at all (TA-Lib behaviour).
     */
    public static double rsi(double[] closes, int period) {
        requirePeriod(period);
        if (closes.length < period + 1) {
            return Double.NaN;
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = closes[i] - closes[i - 1];
            if (change > 0) {
                gain += change;
            } else {
                loss -= change;
            }
        }
        gain /= period;
        loss /= period;
        for (int i = period + 1; i < closes.length; i++) {
            double change = closes[i] - closes[i - 1];
            gain = (gain * (period - 1) + Math.max(change, 0.0)) / period;
            loss = (loss * (period - 1) + Math.max(-change, 0.0)) / period;
        }
        double total = gain + loss;
        return total == 0.0 ? 0.0 : 100.0 * gain / total;
    }

    /**
     * MACD line, signal and histogram at the last index.
     * Both EMAs start at index {@code slow - 1}: the fast one is seeded with the SMA of the
     * {@code fast} closes ending there, as TA-Lib does, not with the first {@code fast} closes.
     *
     * @return {macd, signal, histogram}, or null while the signal line is warming up
     */
    public static double[] macd(double[] closes, int fast, int slow, int signal) {
        if (fast >= slow) {
            throw new IllegalArgumentException("MACD fast period (" + fast + ") must be below slow period (" + slow + ")");
        }
        if (closes.length < slow) {
            return null;
        }
        int fastStart = slow - fast;
        double[] fastEma = nanArray(closes.length);
        double[] fastTail = emaSeries(Arrays.copyOfRange(closes, fastStart, closes.length), fast);
        System.arraycopy(fastTail, 0, fastEma, fastStart, fastTail.length);
        double[] slowEma = emaSeries(closes, slow);
        double[] line = nanArray(closes.length);
        for (int i = slow - 1; i < closes.length; i++) {
            line[i] = fastEma[i] - slowEma[i];
        }
        double[] signalLine = emaSeries(line, signal);
        double macd = last(line);
        double sig = last(signalLine);
        if (Double.isNaN(macd) || Double.isNaN(sig)) {
            return null;
        }
        return new double[] {macd, sig, macd - sig};
    }

    /**
     * Slow stochastic oscillator at the last index.
     * Fast %K = (close - lowest low) / (highest high - lowest low) * 100, 0 on a flat range.
     * Slow %K = SMA(kSlow) of fast %K, %D = SMA(dPeriod) of slow %K.
     *
     * @return {slowK, slowD}, or null while warming up
     */
    public static double[] stochastic(double[] highs, double[] lows, double[] closes,
                                      int kPeriod, int kSlow, int dPeriod) {
        requirePeriod(kPeriod);
        int n = closes.length;
        double[] fastK = nanArray(n);
        for (int i = kPeriod - 1; i < n; i++) {
            double highest = Double.NEGATIVE_INFINITY;
            double lowest = Double.POSITIVE_INFINITY;
            for (int j = i - kPeriod + 1; j <= i; j++) {
                highest = Math.max(highest, highs[j]);
                lowest = Math.min(lowest, lows[j]);
            }
            double range = highest - lowest;
            fastK[i] = range == 0.0 ? 0.0 : (closes[i] - lowest) / range * 100.0;
        }
        double[] slowK = smaSeriesSkippingNaN(fastK, kSlow);
        double[] slowD = smaSeriesSkippingNaN(slowK, dPeriod);
        double k = last(slowK);
        double d = last(slowD);
        if (Double.isNaN(k) || Double.isNaN(d)) {
            return null;
        }
        return new double[] {k, d};
    }

    private static double[] smaSeriesSkippingNaN(double[] values, int period) {
        int start = 0;
        while (start < values.length && Double.isNaN(values[start])) {
            start++;
        }
        double[] out = nanArray(values.length);
        if (start >= values.length) {
            return out;
        }
        double[] tail = smaSeries(Arrays.copyOfRange(values, start, values.length), period);
        System.arraycopy(tail, 0, out, start, tail.length);
        return out;
    }

    private static double last(double[] values) {
        return values.length == 0 ? Double.NaN : values[values.length - 1];
    }

    private static double[] nanArray(int length) {
        double[] out = new double[length];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    private static void requirePeriod(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("Period must be positive, got " + period);
        }
    }
}
