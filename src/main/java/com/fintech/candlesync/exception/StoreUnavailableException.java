package com.fintech.candlesync.exception;

/**
 * Time-series store connection failed, timed out, or the store circuit breaker is open.
 */
public class StoreUnavailableException extends PipelineException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
