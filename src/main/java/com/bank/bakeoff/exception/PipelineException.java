package com.bank.bakeoff.exception;

/**
 * Unexpected failure inside a bake-off or scoring pipeline. The message is
 * captured on the bake-off or run that failed.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
