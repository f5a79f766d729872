package com.fintech.candlesync.sync;

import com.fintech.candlesync.domain.SeriesKey;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory last-synced bucket per series. Not durable: after a restart cursors are
 * rebuilt from the store's newest bucket.
 */
class SyncCursors {

    private final Map<SeriesKey, Long> cursors = new ConcurrentHashMap<>();

    Optional<Long> get(SeriesKey key) {
        return Optional.ofNullable(cursors.get(key));
    }

    /** Moves the cursor forward; never backwards. */
    void advance(SeriesKey key, long bucketStart) {
        cursors.merge(key, bucketStart, Math::max);
    }
}
