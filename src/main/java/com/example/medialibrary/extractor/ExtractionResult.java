package com.example.medialibrary.extractor;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
@Builder
public class ExtractionResult {

    /**
     * File the extractor reports as its final output. May be stale when post-processing renamed it.
     */
    Path primaryFile;

    @Singular
    List<Path> producedFiles;

    MediaMetadata metadata;
}
