package com.example.medialibrary.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One in-flight or recently finished acquisition. Transitions are synchronized on the item so that a
 * pending cancel and the dispatcher claiming the item cannot both succeed; progress fields are only
 * written by the worker that owns the item.
 */
@Getter
@ToString
public class QueueItem {

    private final String id;
    private final long sequence;
    private final String url;
    private final String platform;
    @ToString.Exclude
    private final IngestOptions options;
    private final LocalDateTime createdAt;

    private volatile QueueStatus status;
    private volatile LocalDateTime startedAt;
    private volatile LocalDateTime completedAt;
    private volatile String threadName;

    private volatile long downloadedBytes;
    private volatile Long totalBytes;
    private volatile Double speedBytesPerSecond;
    private volatile Long etaSeconds;
    private volatile double progressPercent;

    private volatile Long recordId;
    private volatile String localPath;
    private volatile String title;
    private volatile String errorMessage;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private final Object lock = new Object();

    private QueueItem(String url, String platform, IngestOptions options, long sequence) {
        this.id = UUID.randomUUID().toString();
        this.sequence = sequence;
        this.url = url;
        this.platform = platform;
        this.options = options != null ? options : IngestOptions.defaults();
        this.createdAt = LocalDateTime.now();
        this.status = QueueStatus.PENDING;
    }

    public static QueueItem create(String url, String platform, IngestOptions options, long sequence) {
        return new QueueItem(url, platform, options, sequence);
    }

    public boolean markAsRunning() {
        synchronized (lock) {
            if (status != QueueStatus.PENDING) {
                return false;
            }
            this.status = QueueStatus.RUNNING;
            this.startedAt = LocalDateTime.now();
            return true;
        }
    }

    public void assignThread(String threadName) {
        this.threadName = threadName;
    }

    public void updateProgress(DownloadProgress progress) {
        this.downloadedBytes = progress.getDownloadedBytes();
        this.totalBytes = progress.getTotalBytes();
        this.speedBytesPerSecond = progress.getSpeedBytesPerSecond();
        this.etaSeconds = progress.getEtaSeconds();
        Double percent = progress.percent();
        if (percent != null) {
            this.progressPercent = percent;
        }
    }

    public void markAsCompleted(MediaRecord record) {
        synchronized (lock) {
            if (status.isTerminal()) {
                return;
            }
            this.recordId = record.getId();
            this.localPath = record.getLocalPath();
            this.title = record.getTitle();
            this.progressPercent = 100.0;
            this.completedAt = LocalDateTime.now();
            this.status = QueueStatus.COMPLETE;
        }
    }

    public void markAsFailed(String errorMessage) {
        synchronized (lock) {
            if (status.isTerminal()) {
                return;
            }
            this.errorMessage = errorMessage;
            this.completedAt = LocalDateTime.now();
            this.status = QueueStatus.FAILED;
        }
    }

    public boolean cancelIfPending() {
        synchronized (lock) {
            if (status != QueueStatus.PENDING) {
                return false;
            }
            this.completedAt = LocalDateTime.now();
            this.status = QueueStatus.CANCELLED;
            return true;
        }
    }

    public void markAsCancelled() {
        synchronized (lock) {
            if (status.isTerminal()) {
                return;
            }
            this.completedAt = LocalDateTime.now();
            this.status = QueueStatus.CANCELLED;
        }
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isFinishedBefore(LocalDateTime cutoff) {
        LocalDateTime finished = completedAt;
        return isTerminal() && finished != null && finished.isBefore(cutoff);
    }
}
