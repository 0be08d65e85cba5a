package com.example.medialibrary.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class LibraryStats {
    long count;
    long totalBytes;
    Map<String, Long> perPlatformCounts;
}
