package com.example.medialibrary.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DownloadProgress {
    long downloadedBytes;
    Long totalBytes;
    Double speedBytesPerSecond;
    Long etaSeconds;

    public Double percent() {
        if (totalBytes == null || totalBytes <= 0) {
            return null;
        }
        return Math.min(100.0, (double) downloadedBytes / totalBytes * 100);
    }
}
