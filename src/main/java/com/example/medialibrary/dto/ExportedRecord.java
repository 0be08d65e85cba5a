package com.example.medialibrary.dto;

import com.example.medialibrary.model.MediaRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Curated, raw-metadata-free view of a record as written to JSON exports.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExportedRecord {
    private Long id;
    private String url;
    private String platform;
    private String sourceId;
    private String title;
    private String description;
    private String uploader;
    private String uploaderId;
    private String uploadDate;
    private Integer durationSeconds;
    private Long viewCount;
    private Long likeCount;
    private Long commentCount;
    private String resolution;
    private Double fps;
    private String codec;
    private Long fileSizeBytes;
    private String fileHashSha256;
    private String localPath;
    private String thumbnailPath;
    private String ingestedAt;
    private List<String> tags;
    private Integer rating;
    private String notes;
    private String collection;

    public static ExportedRecord from(MediaRecord record) {
        return ExportedRecord.builder()
                .id(record.getId())
                .url(record.getSourceUrl())
                .platform(record.getPlatform())
                .sourceId(record.getSourceId())
                .title(record.getTitle())
                .description(record.getDescription())
                .uploader(record.getUploader())
                .uploaderId(record.getUploaderId())
                .uploadDate(record.getUploadDate() != null ? record.getUploadDate().toString() : null)
                .durationSeconds(record.getDurationSeconds())
                .viewCount(record.getViewCount())
                .likeCount(record.getLikeCount())
                .commentCount(record.getCommentCount())
                .resolution(record.getResolution())
                .fps(record.getFps())
                .codec(record.getCodec())
                .fileSizeBytes(record.getFileSizeBytes())
                .fileHashSha256(record.getContentHash())
                .localPath(record.getLocalPath())
                .thumbnailPath(record.getThumbnailPath())
                .ingestedAt(record.getIngestedAt() != null ? record.getIngestedAt().toString() : null)
                .tags(new ArrayList<>(record.getTags() != null ? record.getTags() : List.of()))
                .rating(record.getRating())
                .notes(record.getNotes())
                .collection(record.getCollection())
                .build();
    }
}
