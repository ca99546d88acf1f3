package com.gemflush.orchestrator.pipeline;

/** Network failure or timeout talking to an external capability. Retried with backoff. */
public class RetryableIoException extends StageException {

    public RetryableIoException(String message) {
        super(message, true);
    }

    public RetryableIoException(String message, Throwable cause) {
        super(message, true, cause);
    }
}
