package com.example.medialibrary.exception;

/**
 * Base of every failure an ingest run can end with. The acquisition queue does not interpret the
 * subtype; callers that want to present or retry do.
 */
public abstract class IngestException extends RuntimeException {

    protected IngestException(String message) {
        super(message);
    }

    protected IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
