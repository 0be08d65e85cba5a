package com.example.medialibrary.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class QueueItemTest {

    private QueueItem newItem() {
        return QueueItem.create("https://youtu.be/a", "youtube", null, 1);
    }

    @Test
    void pendingCancelAndClaimAreExclusive() {
        QueueItem item = newItem();

        assertThat(item.cancelIfPending()).isTrue();
        assertThat(item.markAsRunning()).isFalse();
        assertThat(item.getStatus()).isEqualTo(QueueStatus.CANCELLED);
        assertThat(item.getOptions()).isNotNull();
    }

    @Test
    void terminalStatesNeverChange() {
        QueueItem item = newItem();
        assertThat(item.markAsRunning()).isTrue();
        assertThat(item.getStartedAt()).isNotNull();

        item.markAsFailed("boom");
        item.markAsCompleted(MediaRecord.builder().id(1L).build());
        item.markAsCancelled();

        assertThat(item.getStatus()).isEqualTo(QueueStatus.FAILED);
        assertThat(item.getErrorMessage()).isEqualTo("boom");
        assertThat(item.getRecordId()).isNull();
        assertThat(item.cancelIfPending()).isFalse();
    }

    @Test
    void completionRecordsResult() {
        QueueItem item = newItem();
        item.markAsRunning();
        item.updateProgress(DownloadProgress.builder().downloadedBytes(10).totalBytes(40L).build());
        assertThat(item.getProgressPercent()).isEqualTo(25.0);

        item.markAsCompleted(MediaRecord.builder().id(9L).title("Clip").localPath("/lib/clip.mp4").build());

        assertThat(item.getStatus()).isEqualTo(QueueStatus.COMPLETE);
        assertThat(item.getRecordId()).isEqualTo(9L);
        assertThat(item.getTitle()).isEqualTo("Clip");
        assertThat(item.getProgressPercent()).isEqualTo(100.0);
        assertThat(item.isFinishedBefore(LocalDateTime.now().plusSeconds(1))).isTrue();
        assertThat(item.isFinishedBefore(LocalDateTime.now().minusHours(1))).isFalse();
    }

    @Test
    void unknownTotalLeavesPercentUntouched() {
        QueueItem item = newItem();
        item.markAsRunning();

        item.updateProgress(DownloadProgress.builder().downloadedBytes(10).build());

        assertThat(item.getDownloadedBytes()).isEqualTo(10);
        assertThat(item.getProgressPercent()).isZero();
        assertThat(item.isFinishedBefore(LocalDateTime.now().plusDays(1))).isFalse();
    }
}
