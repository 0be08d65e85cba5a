package com.example.medialibrary.exception;

public class ExtractionException extends IngestException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
