package com.example.medialibrary.model;

public enum DuplicateKind {
    URL,
    SOURCE_ID,
    CONTENT_HASH
}
