package com.example.medialibrary.exception;

public class LibraryStoreException extends IngestException {

    public LibraryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
