package com.fintech.candlesync.support;

import com.fintech.candlesync.domain.IndicatorSet;
import com.fintech.candlesync.exception.StoreUnavailableException;
import com.fintech.candlesync.store.memory.InMemoryTimeSeriesStore;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store whose indicator writes fail for selected buckets.
 */
public class FlakyTimeSeriesStore extends InMemoryTimeSeriesStore {

    private final Set<Long> failingBuckets = ConcurrentHashMap.newKeySet();

    public void failIndicatorWritesAt(long bucketStart) {
        failingBuckets.add(bucketStart);
    }

    public void recover() {
        failingBuckets.clear();
    }

    @Override
    public void insertIndicators(IndicatorSet set) {
        if (failingBuckets.contains(set.bucketStart())) {
            throw new StoreUnavailableException("write timed out");
        }
        super.insertIndicators(set);
    }
}
