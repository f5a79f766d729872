package com.fintech.candlesync.domain;

import java.util.Arrays;

/**
 * Candle timeframes with epoch-aligned bucket calculations.
 * Codes follow the exchange convention ("1m", "5m", "1h").
 */
public enum Timeframe {

    M1("1m", 60_000L),
    M5("5m", 300_000L),
    M15("15m", 900_000L),
    H1("1h", 3_600_000L),
    H4("4h", 14_400_000L),
    D1("1d", 86_400_000L);

    private final String code;
    private final long milliseconds;

    Timeframe(String code, long milliseconds) {
        this.code = code;
        this.milliseconds = milliseconds;
    }

    /** Returns the exchange-style code, e.g. "5m". */
    public String code() {
        return code;
    }

    /** Returns bucket duration in milliseconds. */
    public long toMillis() {
        return milliseconds;
    }

    /**
     * Aligns timestamp to bucket start: (timestamp / bucketMs) * bucketMs.
     * Integer division floors to nearest boundary.
     */
    public long alignTimestamp(long timestamp) {
        return Math.floorDiv(timestamp, milliseconds) * milliseconds;
    }

    /** Returns exclusive bucket end: bucketStart + bucketMs. */
    public long windowEnd(long bucketStart) {
        return bucketStart + milliseconds;
    }

    /** Returns true if the timestamp sits exactly on a bucket boundary. */
    public boolean isAligned(long timestamp) {
        return alignTimestamp(timestamp) == timestamp;
    }

    /** Returns the bucket start {@code count} buckets after (or before, if negative) the given one. */
    public long shift(long bucketStart, long count) {
        return bucketStart + count * milliseconds;
    }

    /** Returns true if this timeframe is strictly longer than and divisible by {@code other}. */
    public boolean isCoarserThan(Timeframe other) {
        return milliseconds > other.milliseconds && milliseconds % other.milliseconds == 0;
    }

    /**
     * Resolves "5m" or "M5" style identifiers.
     *
     * @throws IllegalArgumentException for unknown codes
     */
    public static Timeframe fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Timeframe code cannot be null");
        }
        String trimmed = code.trim();
        return Arrays.stream(values())
            .filter(tf -> tf.code.equalsIgnoreCase(trimmed) || tf.name().equalsIgnoreCase(trimmed))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unsupported timeframe: " + code + ". Must be one of: 1m, 5m, 15m, 1h, 4h, 1d"));
    }
}
