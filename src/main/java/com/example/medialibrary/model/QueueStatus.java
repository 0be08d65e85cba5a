package com.example.medialibrary.model;

public enum QueueStatus {
    PENDING,
    RUNNING,
    COMPLETE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == CANCELLED;
    }
}
