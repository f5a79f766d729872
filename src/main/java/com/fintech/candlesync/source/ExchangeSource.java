package com.fintech.candlesync.source;

import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.Timeframe;

import java.util.List;

/**
 * Authoritative OHLCV provider for one exchange.
 */
public interface ExchangeSource {

    /** Configured source name, used as the series key's source. */
    String name();

    /**
     * Fetches bars for one instrument, oldest first.
     * The newest bar may still be open. Near the start of the exchange's history fewer than
     * {@code limit} rows may come back.
     *
     * @param since first bucket start to include, or null for the most recent {@code limit} bars
     * @throws com.fintech.candlesync.exception.SourceUnavailableException on network errors,
     *         timeouts, rate limits or server errors
     * @throws com.fintech.candlesync.exception.MalformedDataException if the payload cannot be parsed
     */
    List<Candle> fetchOhlcv(String instrument, Timeframe timeframe, Long since, int limit);
}
