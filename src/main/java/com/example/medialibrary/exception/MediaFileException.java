package com.example.medialibrary.exception;

/**
 * Local filesystem failure during an ingest run: missing output, failed move, failed hashing.
 */
public class MediaFileException extends IngestException {

    public MediaFileException(String message) {
        super(message);
    }

    public MediaFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
