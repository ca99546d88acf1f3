package com.gemflush.orchestrator.pipeline;

/** Malformed input such as an unusable URL. Fatal, never retried. */
public class InvalidInputException extends StageException {

    public InvalidInputException(String message) {
        super(message, false);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, false, cause);
    }
}
