package com.example.medialibrary.service;

import com.example.medialibrary.config.LibraryLayout;
import com.example.medialibrary.config.MediaLibraryProperties;
import com.example.medialibrary.exception.DuplicateMediaException;
import com.example.medialibrary.exception.ExtractionException;
import com.example.medialibrary.exception.IngestCancelledException;
import com.example.medialibrary.extractor.ProgressChannel;
import com.example.medialibrary.model.CancellationToken;
import com.example.medialibrary.model.DownloadProgress;
import com.example.medialibrary.model.DuplicateKind;
import com.example.medialibrary.model.MediaRecord;
import com.example.medialibrary.model.QueueItem;
import com.example.medialibrary.model.QueueStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AcquisitionQueueServiceTest {

    private final IngestService ingestService = mock(IngestService.class);
    private final AtomicLong recordIds = new AtomicLong();
    private AcquisitionQueueService queue;
    private MetricsService metrics;

    private AcquisitionQueueService startQueue(int maxConcurrent) {
        MediaLibraryProperties properties = new MediaLibraryProperties();
        properties.getQueue().setMaxConcurrent(maxConcurrent);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(maxConcurrent, maxConcurrent, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>());
        metrics = new MetricsService(new SimpleMeterRegistry(), executor);
        queue = new AcquisitionQueueService(ingestService, new LibraryLayout(properties), executor, metrics, properties);
        queue.start();
        return queue;
    }

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.shutdown();
        }
    }

    private MediaRecord record(String url) {
        return MediaRecord.builder().id(recordIds.incrementAndGet()).sourceUrl(url).title("t " + url).build();
    }

    private void stubIngest(Answer<MediaRecord> answer) {
        when(ingestService.ingest(anyString(), any(), any(), any())).thenAnswer(answer);
    }

    @Test
    void neverRunsMoreThanMaxConcurrent() {
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        stubIngest(invocation -> {
            int running = current.incrementAndGet();
            peak.accumulateAndGet(running, Math::max);
            Thread.sleep(50);
            current.decrementAndGet();
            return record(invocation.getArgument(0));
        });
        startQueue(3);

        List<QueueItem> items = queue.enqueueBatch(
                List.of("u1", "u2", "u3", "u4", "u5", "u6", "u7", "u8", "u9", "u10"));

        await().atMost(Duration.ofSeconds(10))
                .until(() -> items.stream().allMatch(item -> item.getStatus() == QueueStatus.COMPLETE));
        assertThat(peak.get()).isBetween(1, 3);
        assertThat(queue.getRunningCount()).isZero();
        assertThat(queue.getPendingCount()).isZero();
        assertThat(queue.getCompleteCount()).isEqualTo(10);
        await().atMost(Duration.ofSeconds(5)).until(() -> metrics.getCompletedCount() == 10.0);
    }

    @Test
    void singleSlotAdmitsInFifoOrder() {
        List<String> started = new CopyOnWriteArrayList<>();
        stubIngest(invocation -> {
            started.add(invocation.getArgument(0));
            return record(invocation.getArgument(0));
        });
        startQueue(1);

        List<String> urls = List.of("a", "b", "c", "d", "e");
        queue.enqueueBatch(urls);

        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getCompleteCount() == urls.size());
        assertThat(started).containsExactlyElementsOf(urls);
        assertThat(queue.getItems()).extracting(QueueItem::getUrl).containsExactlyElementsOf(urls);
    }

    @Test
    void cancelPendingItemNeverRunsIt() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        stubIngest(invocation -> {
            if ("first".equals(invocation.getArgument(0))) {
                release.await(5, TimeUnit.SECONDS);
            }
            return record(invocation.getArgument(0));
        });
        startQueue(1);
        RecordingListener listener = new RecordingListener();
        queue.addListener(listener);

        QueueItem first = queue.enqueue("first");
        QueueItem second = queue.enqueue("second");
        await().atMost(Duration.ofSeconds(5)).until(() -> first.getStatus() == QueueStatus.RUNNING);

        assertThat(queue.cancel(second.getId())).isTrue();
        assertThat(second.getStatus()).isEqualTo(QueueStatus.CANCELLED);
        assertThat(second.getCompletedAt()).isNotNull();
        assertThat(listener.events).contains("cancelled:second");

        release.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> first.getStatus() == QueueStatus.COMPLETE);
        verify(ingestService, never()).ingest(eq("second"), any(), any(), any());
        assertThat(queue.cancel(second.getId())).isFalse();
        assertThat(queue.cancel(first.getId())).isFalse();
    }

    @Test
    void cancelRunningItemStopsItAndFreesTheSlot() {
        stubIngest(invocation -> {
            CancellationToken token = invocation.getArgument(3);
            if ("slow".equals(invocation.getArgument(0))) {
                while (!token.isCancelled()) {
                    Thread.sleep(10);
                }
                throw new IngestCancelledException("cancelled");
            }
            return record(invocation.getArgument(0));
        });
        startQueue(1);

        QueueItem slow = queue.enqueue("slow");
        QueueItem next = queue.enqueue("next");
        await().atMost(Duration.ofSeconds(5)).until(() -> slow.getStatus() == QueueStatus.RUNNING);

        assertThat(queue.cancel(slow.getId())).isTrue();

        await().atMost(Duration.ofSeconds(5)).until(() -> next.getStatus() == QueueStatus.COMPLETE);
        assertThat(slow.getStatus()).isEqualTo(QueueStatus.CANCELLED);
        assertThat(slow.getCompletedAt()).isNotNull();
        assertThat(queue.getRunningCount()).isZero();
        assertThat(metrics.getCancelledCount()).isEqualTo(1.0);
    }

    @Test
    void failureIsRecordedWithMessage() {
        stubIngest(invocation -> {
            String url = invocation.getArgument(0);
            if ("broken".equals(url)) {
                throw new ExtractionException("HTTP Error 404");
            }
            if ("silent".equals(url)) {
                throw new IllegalStateException();
            }
            throw DuplicateMediaException.byUrl(url, 1L);
        });
        startQueue(2);
        RecordingListener listener = new RecordingListener();
        queue.addListener(listener);

        QueueItem broken = queue.enqueue("broken");
        QueueItem silent = queue.enqueue("silent");
        QueueItem duplicate = queue.enqueue("dup");

        await().atMost(Duration.ofSeconds(5)).until(() -> listener.events.size() == 3);
        assertThat(queue.getFailedCount()).isEqualTo(3);
        assertThat(broken.getErrorMessage()).isEqualTo("HTTP Error 404");
        assertThat(silent.getErrorMessage()).isEqualTo("IllegalStateException");
        assertThat(duplicate.getErrorMessage()).contains("dup");
        assertThat(listener.events).contains("error:broken", "error:silent", "error:dup");
        assertThat(metrics.getDuplicateCount(DuplicateKind.URL)).isEqualTo(1.0);
        await().atMost(Duration.ofSeconds(5)).until(() -> metrics.getFailedCount() == 3.0);
    }

    @Test
    void progressIsAppliedToTheItemAndPublished() {
        stubIngest(invocation -> {
            ProgressChannel progress = invocation.getArgument(2);
            progress.publish(DownloadProgress.builder().downloadedBytes(50).totalBytes(200L).build());
            return record(invocation.getArgument(0));
        });
        startQueue(1);
        RecordingListener listener = new RecordingListener();
        queue.addListener(listener);

        QueueItem item = queue.enqueue("https://youtu.be/xyz");

        await().atMost(Duration.ofSeconds(5)).until(() -> item.getStatus() == QueueStatus.COMPLETE);
        assertThat(item.getDownloadedBytes()).isEqualTo(50);
        assertThat(item.getTotalBytes()).isEqualTo(200L);
        assertThat(item.getProgressPercent()).isEqualTo(100.0);
        assertThat(item.getPlatform()).isEqualTo("youtube");
        assertThat(item.getRecordId()).isNotNull();
        assertThat(item.getThreadName()).startsWith("pool-");
        await().atMost(Duration.ofSeconds(5))
                .until(() -> listener.events.contains("complete:https://youtu.be/xyz"));
        assertThat(listener.events)
                .containsExactly("progress:https://youtu.be/xyz", "complete:https://youtu.be/xyz");
    }

    @Test
    void throwingListenerDoesNotAffectTheRun() {
        stubIngest(invocation -> record(invocation.getArgument(0)));
        startQueue(1);
        queue.addListener(new AcquisitionListener() {
            @Override
            public void onComplete(QueueItem item) {
                throw new IllegalStateException("listener failure");
            }
        });
        RecordingListener listener = new RecordingListener();
        queue.addListener(listener);

        QueueItem item = queue.enqueue("u");

        await().atMost(Duration.ofSeconds(5)).until(() -> listener.events.contains("complete:u"));
        assertThat(item.getStatus()).isEqualTo(QueueStatus.COMPLETE);
    }

    @Test
    void removeClearAndExpire() {
        stubIngest(invocation -> record(invocation.getArgument(0)));
        startQueue(2);

        QueueItem a = queue.enqueue("a");
        QueueItem b = queue.enqueue("b");
        QueueItem c = queue.enqueue("c");
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getCompleteCount() == 3);

        assertThat(queue.remove(a.getId())).isTrue();
        assertThat(queue.getItem(a.getId())).isEmpty();
        assertThat(queue.remove(a.getId())).isFalse();
        assertThat(queue.remove("unknown")).isFalse();

        assertThat(queue.expireStale(Duration.ofHours(1))).isZero();
        assertThat(queue.clearCompleted()).isEqualTo(2);
        assertThat(queue.getItems()).isEmpty();

        QueueItem d = queue.enqueue("d");
        await().atMost(Duration.ofSeconds(5)).until(() -> d.getStatus() == QueueStatus.COMPLETE);
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.expireStale(Duration.ZERO) == 1);
        assertThat(queue.getItem(d.getId())).isEmpty();
        assertThat(b.isTerminal()).isTrue();
        assertThat(c.isTerminal()).isTrue();
    }

    @Test
    void rejectsBlankUrlAndUseAfterShutdown() {
        startQueue(1);
        assertThatThrownBy(() -> queue.enqueue(" ")).isInstanceOf(IllegalArgumentException.class);

        queue.shutdown();
        assertThatThrownBy(() -> queue.enqueue("u")).isInstanceOf(IllegalStateException.class);
        queue = null;
    }

    private static class RecordingListener implements AcquisitionListener {
        private final List<String> events = new CopyOnWriteArrayList<>();

        @Override
        public void onProgress(QueueItem item) {
            events.add("progress:" + item.getUrl());
        }

        @Override
        public void onComplete(QueueItem item) {
            events.add("complete:" + item.getUrl());
        }

        @Override
        public void onError(QueueItem item) {
            events.add("error:" + item.getUrl());
        }

        @Override
        public void onCancelled(QueueItem item) {
            events.add("cancelled:" + item.getUrl());
        }
    }
}
