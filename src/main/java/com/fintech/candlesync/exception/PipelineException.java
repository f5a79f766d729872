package com.fintech.candlesync.exception;

/**
 * Base type for failures raised inside the sync and indicator pipeline.
 * Unchecked: every failure is isolated and logged at the unit that can fail independently.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
