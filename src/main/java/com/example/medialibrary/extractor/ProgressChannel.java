package com.example.medialibrary.extractor;

import com.example.medialibrary.model.DownloadProgress;

@FunctionalInterface
public interface ProgressChannel {

    ProgressChannel NONE = progress -> {
    };

    void publish(DownloadProgress progress);
}
