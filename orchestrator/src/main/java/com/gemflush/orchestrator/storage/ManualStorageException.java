package com.gemflush.orchestrator.storage;

public class ManualStorageException extends RuntimeException {

    public ManualStorageException(String message) {
        super(message);
    }

    public ManualStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
