package com.fintech.candlesync.exception;

/**
 * Source returned data that cannot be parsed or fails basic sanity checks.
 */
public class MalformedDataException extends PipelineException {

    public MalformedDataException(String message) {
        super(message);
    }

    public MalformedDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
