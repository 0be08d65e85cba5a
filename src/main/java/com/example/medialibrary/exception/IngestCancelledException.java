package com.example.medialibrary.exception;

public class IngestCancelledException extends IngestException {

    public IngestCancelledException(String message) {
        super(message);
    }
}
