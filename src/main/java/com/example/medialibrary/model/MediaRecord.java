package com.example.medialibrary.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MediaRecord {
    private Long id;

    private String sourceUrl;
    private String platform;
    private String sourceId;

    private String title;
    private String description;
    private String uploader;
    private String uploaderId;
    private LocalDate uploadDate;
    private Integer durationSeconds;
    private Long viewCount;
    private Long likeCount;
    private Long commentCount;

    private String resolution;
    private Double fps;
    private String codec;
    private Long fileSizeBytes;
    private String contentHash;

    private String localPath;
    private String thumbnailPath;
    private LocalDateTime ingestedAt;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private Integer rating;
    private String notes;
    private String collection;

    private String rawMetadata;
}
