package com.example.medialibrary.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

// DDL lives in schema.sql together with the FTS5 table and its triggers
@Entity
@Table(name = "media_records",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_media_source_url", columnNames = "source_url"),
                @UniqueConstraint(name = "uq_media_platform_source", columnNames = {"platform", "source_id"}),
                @UniqueConstraint(name = "uq_media_content_hash", columnNames = "content_hash")
        },
        indexes = {
                @Index(name = "idx_media_platform", columnList = "platform"),
                @Index(name = "idx_media_uploader", columnList = "uploader"),
                @Index(name = "idx_media_ingested_at", columnList = "ingested_at"),
                @Index(name = "idx_media_collection", columnList = "collection")
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "source_url", nullable = false)
    private String sourceUrl;

    @Column(name = "platform", nullable = false)
    private String platform;

    @Column(name = "source_id", nullable = false)
    private String sourceId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "description")
    private String description;

    @Column(name = "uploader", nullable = false)
    private String uploader;

    @Column(name = "uploader_id")
    private String uploaderId;

    @Column(name = "upload_date")
    private LocalDate uploadDate;

    @Column(name = "duration_seconds")
    private Integer durationSeconds;

    @Column(name = "view_count")
    private Long viewCount;

    @Column(name = "like_count")
    private Long likeCount;

    @Column(name = "comment_count")
    private Long commentCount;

    @Column(name = "resolution")
    private String resolution;

    @Column(name = "fps")
    private Double fps;

    @Column(name = "codec")
    private String codec;

    @Column(name = "file_size_bytes")
    private Long fileSizeBytes;

    @Column(name = "content_hash")
    private String contentHash;

    @Column(name = "local_path")
    private String localPath;

    @Column(name = "thumbnail_path")
    private String thumbnailPath;

    @Column(name = "ingested_at")
    private LocalDateTime ingestedAt;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "tags", nullable = false)
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Column(name = "rating")
    private Integer rating;

    @Column(name = "notes")
    private String notes;

    @Column(name = "collection")
    private String collection;

    @Column(name = "raw_metadata")
    private String rawMetadata;
}
