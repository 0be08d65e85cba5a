package com.example.medialibrary.extractor;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Source-provided metadata of one item. Every field is optional; {@code uploadDate} keeps the source's
 * {@code YYYYMMDD} form.
 */
@Value
@Builder(toBuilder = true)
public class MediaMetadata {
    String id;
    String title;
    String description;
    String uploader;
    String uploaderId;
    String uploadDate;
    Double duration;
    Long viewCount;
    Long likeCount;
    Long commentCount;
    Integer width;
    Integer height;
    Double fps;
    String vcodec;
    String thumbnailUrl;

    @Builder.Default
    Map<String, Object> raw = Map.of();
}
