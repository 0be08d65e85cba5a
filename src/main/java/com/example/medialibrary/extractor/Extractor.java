package com.example.medialibrary.extractor;

import com.example.medialibrary.exception.ExtractionException;
import com.example.medialibrary.model.CancellationToken;

/**
 * Fetches one media item into a directory owned by the caller. Implementations must write only inside
 * {@link ExtractionRequest#getTargetDirectory()} and should stop promptly once the token is cancelled.
 */
public interface Extractor {

    ExtractionResult extract(ExtractionRequest request, ProgressChannel progress, CancellationToken cancellation)
            throws ExtractionException;
}
