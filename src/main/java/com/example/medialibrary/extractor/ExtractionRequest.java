package com.example.medialibrary.extractor;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class ExtractionRequest {
    String url;
    String platform;
    Path targetDirectory;
    String formatId;
}
