package com.gemflush.orchestrator.pipeline;

/**
 * Base failure of a pipeline stage.
 *
 * The retryable flag is what the orchestrator reports to users and what the
 * retry policy keys on; subclasses fix it to the right value.
 */
public class StageException extends RuntimeException {

    private final boolean retryable;

    public StageException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public StageException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
