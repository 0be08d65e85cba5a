package com.example.medialibrary.exception;

import com.example.medialibrary.model.DuplicateKind;
import lombok.Getter;

@Getter
public class DuplicateMediaException extends IngestException {

    private final DuplicateKind kind;
    private final Long existingRecordId;

    public DuplicateMediaException(DuplicateKind kind, String message, Long existingRecordId) {
        super(message);
        this.kind = kind;
        this.existingRecordId = existingRecordId;
    }

    public static DuplicateMediaException byUrl(String url, Long existingRecordId) {
        return new DuplicateMediaException(DuplicateKind.URL, "URL уже есть в библиотеке: " + url, existingRecordId);
    }

    public static DuplicateMediaException inFlight(String url) {
        return new DuplicateMediaException(DuplicateKind.URL, "URL уже загружается: " + url, null);
    }

    public static DuplicateMediaException bySourceId(String platform, String sourceId, Long existingRecordId) {
        return new DuplicateMediaException(DuplicateKind.SOURCE_ID,
                "Запись " + platform + "/" + sourceId + " уже есть в библиотеке", existingRecordId);
    }

    public static DuplicateMediaException byContentHash(String hash, Long existingRecordId) {
        String shortHash = hash.length() > 12 ? hash.substring(0, 12) + "..." : hash;
        return new DuplicateMediaException(DuplicateKind.CONTENT_HASH,
                "Содержимое файла уже есть в библиотеке (hash: " + shortHash + ")", existingRecordId);
    }
}
