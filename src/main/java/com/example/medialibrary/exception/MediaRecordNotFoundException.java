package com.example.medialibrary.exception;

import lombok.Getter;

@Getter
public class MediaRecordNotFoundException extends RuntimeException {

    private final long recordId;

    public MediaRecordNotFoundException(long recordId) {
        super("Запись не найдена: id=" + recordId);
        this.recordId = recordId;
    }
}
