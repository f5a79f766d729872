package com.fintech.candlesync.exception;

/**
 * Exchange source could not serve a request (network error, timeout, rate limit, 5xx).
 * Retryable unless the exchange rejected the request itself.
 */
public class SourceUnavailableException extends PipelineException {

    private final String source;
    private final boolean retryable;

    public SourceUnavailableException(String source, String message, Throwable cause) {
        this(source, message, cause, true);
    }

    public SourceUnavailableException(String source, String message, Throwable cause, boolean retryable) {
        super("[" + source + "] " + message, cause);
        this.source = source;
        this.retryable = retryable;
    }

    public String getSource() {
        return source;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
