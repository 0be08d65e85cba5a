package com.example.medialibrary.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class MetadataSanitizer {

    private static final Set<String> EXCLUDED_KEYS = Set.of(
            "formats",
            "thumbnails",
            "subtitles",
            "automatic_captions",
            "requested_downloads",
            "requested_formats",
            "http_headers",
            "_filename"
    );

    private MetadataSanitizer() {
    }

    /**
     * Drops the large and internal parts of a source info dictionary before it is stored as raw metadata.
     */
    public static Map<String, Object> sanitize(Map<String, Object> info) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        if (info == null) {
            return sanitized;
        }
        info.forEach((key, value) -> {
            if (!EXCLUDED_KEYS.contains(key) && !key.startsWith("_")) {
                sanitized.put(key, value);
            }
        });
        return sanitized;
    }
}
