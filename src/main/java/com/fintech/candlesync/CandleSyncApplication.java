package com.fintech.candlesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Keeps multi-timeframe OHLCV candles in sync with the exchange and derives
 * technical indicators from them on a schedule.
 */
@SpringBootApplication
public class CandleSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CandleSyncApplication.class, args);
    }
}
