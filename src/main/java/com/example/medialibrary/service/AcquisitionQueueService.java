package com.example.medialibrary.service;

import com.example.medialibrary.config.LibraryLayout;
import com.example.medialibrary.config.MediaLibraryProperties;
import com.example.medialibrary.exception.DuplicateMediaException;
import com.example.medialibrary.exception.IngestCancelledException;
import com.example.medialibrary.exception.IngestException;
import com.example.medialibrary.model.CancellationToken;
import com.example.medialibrary.model.IngestOptions;
import com.example.medialibrary.model.MediaRecord;
import com.example.medialibrary.model.QueueItem;
import com.example.medialibrary.model.QueueStatus;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory acquisition queue. A single dispatcher thread admits pending items in FIFO order, at most
 * {@code media-library.queue.max-concurrent} at a time, and hands each to the ingest executor. A permit is
 * returned only once its item has reached a terminal state.
 */
@Service
@Slf4j
public class AcquisitionQueueService {

    private static final String MDC_ITEM_ID = "itemId";

    private final IngestService ingestService;
    private final LibraryLayout layout;
    private final ThreadPoolExecutor ingestExecutor;
    private final MetricsService metricsService;
    private final MediaLibraryProperties properties;

    private final Map<String, QueueItem> items = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final BlockingQueue<String> pendingIds = new LinkedBlockingQueue<>();
    private final List<AcquisitionListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Semaphore permits;

    private volatile boolean running;
    private Thread dispatcher;

    public AcquisitionQueueService(IngestService ingestService,
                                   LibraryLayout layout,
                                   @Qualifier("ingestExecutor") ThreadPoolExecutor ingestExecutor,
                                   MetricsService metricsService,
                                   MediaLibraryProperties properties) {
        this.ingestService = ingestService;
        this.layout = layout;
        this.ingestExecutor = ingestExecutor;
        this.metricsService = metricsService;
        this.properties = properties;
        this.permits = new Semaphore(properties.getQueue().getMaxConcurrent(), true);
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatcher = new Thread(this::dispatchLoop, "acquisition-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        metricsService.registerQueueGauges(this::getPendingCount, this::getRunningCount);
        log.info("Очередь загрузок запущена: maxConcurrent={}", properties.getQueue().getMaxConcurrent());
    }

    public QueueItem enqueue(String url) {
        return enqueue(url, IngestOptions.defaults());
    }

    public QueueItem enqueue(String url, IngestOptions options) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL не может быть пустым");
        }
        if (!running) {
            throw new IllegalStateException("Очередь загрузок остановлена");
        }
        String trimmed = url.trim();
        QueueItem item = QueueItem.create(trimmed, layout.detectPlatform(trimmed), options, sequence.incrementAndGet());
        items.put(item.getId(), item);
        tokens.put(item.getId(), new CancellationToken());
        pendingIds.add(item.getId());
        metricsService.incrementSubmitted();
        log.info("Добавлено в очередь: id={}, url={}, platform={}", item.getId(), item.getUrl(), item.getPlatform());
        return item;
    }

    public List<QueueItem> enqueueBatch(List<String> urls) {
        return enqueueBatch(urls, IngestOptions.defaults());
    }

    public List<QueueItem> enqueueBatch(List<String> urls, IngestOptions options) {
        List<QueueItem> added = new ArrayList<>();
        for (String url : urls) {
            added.add(enqueue(url, options));
        }
        return added;
    }

    /**
     * Cancels a pending item immediately, or asks a running one to stop at its next checkpoint.
     *
     * @return false for unknown and already finished items
     */
    public boolean cancel(String itemId) {
        QueueItem item = items.get(itemId);
        if (item == null) {
            return false;
        }
        if (item.cancelIfPending()) {
            tokens.remove(itemId);
            metricsService.incrementCancelled();
            log.info("Отменен ожидающий элемент: id={}", itemId);
            notifyListeners(item, listener -> listener.onCancelled(item));
            return true;
        }
        if (item.getStatus() == QueueStatus.RUNNING) {
            CancellationToken token = tokens.get(itemId);
            if (token != null && token.cancel()) {
                log.info("Запрошена отмена выполняющейся загрузки: id={}", itemId);
                return true;
            }
        }
        return false;
    }

    public boolean remove(String itemId) {
        cancel(itemId);
        boolean removed = items.remove(itemId) != null;
        if (removed) {
            log.debug("Удален элемент очереди: id={}", itemId);
        }
        return removed;
    }

    public int clearCompleted() {
        int cleared = removeWhere(QueueItem::isTerminal);
        log.info("Очищено {} завершенных элементов", cleared);
        return cleared;
    }

    public int expireStale(Duration maxAge) {
        LocalDateTime cutoff = LocalDateTime.now().minus(maxAge);
        int expired = removeWhere(item -> item.isFinishedBefore(cutoff));
        if (expired > 0) {
            log.info("Удалено {} устаревших элементов очереди", expired);
        }
        return expired;
    }

    @Scheduled(fixedDelayString = "${media-library.queue.expire-interval-ms:60000}")
    public void expireStaleItems() {
        expireStale(properties.getQueue().getStaleAfter());
    }

    public Optional<QueueItem> getItem(String itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    public List<QueueItem> getItems() {
        return items.values().stream()
                .sorted(Comparator.comparingLong(QueueItem::getSequence))
                .collect(Collectors.toList());
    }

    public int getPendingCount() {
        return countByStatus(QueueStatus.PENDING);
    }

    public int getRunningCount() {
        return countByStatus(QueueStatus.RUNNING);
    }

    public int getCompleteCount() {
        return countByStatus(QueueStatus.COMPLETE);
    }

    public int getFailedCount() {
        return countByStatus(QueueStatus.FAILED);
    }

    public int getCancelledCount() {
        return countByStatus(QueueStatus.CANCELLED);
    }

    public void addListener(AcquisitionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(AcquisitionListener listener) {
        listeners.remove(listener);
    }

    public void shutdown() {
        log.info("Начало graceful shutdown очереди загрузок");

        synchronized (this) {
            running = false;
            if (dispatcher != null) {
                dispatcher.interrupt();
            }
        }

        items.values().forEach(QueueItem::cancelIfPending);
        tokens.values().forEach(CancellationToken::cancel);

        ingestExecutor.shutdown();
        try {
            if (!ingestExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Принудительное завершение потоков загрузки");
                ingestExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Ошибка при ожидании завершения потоков", e);
            ingestExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Очередь загрузок остановлена");
    }

    private void dispatchLoop() {
        while (running) {
            try {
                String itemId = pendingIds.take();
                QueueItem item = items.get(itemId);
                if (item == null || item.getStatus() != QueueStatus.PENDING) {
                    continue;
                }
                permits.acquire();
                dispatch(item);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Диспетчер очереди остановлен");
    }

    private void dispatch(QueueItem item) {
        CancellationToken token = tokens.get(item.getId());
        if (token == null || !item.markAsRunning()) {
            // cancelled or removed while waiting for a permit
            permits.release();
            return;
        }
        try {
            ingestExecutor.execute(() -> runItem(item, token));
        } catch (RejectedExecutionException e) {
            log.error("Пул загрузок отклонил задачу: id={}", item.getId(), e);
            item.markAsFailed("Пул загрузок остановлен");
            tokens.remove(item.getId());
            permits.release();
            metricsService.incrementFailed();
            notifyListeners(item, listener -> listener.onError(item));
        }
    }

    private void runItem(QueueItem item, CancellationToken token) {
        MDC.put(MDC_ITEM_ID, item.getId());
        String threadName = Thread.currentThread().getName();
        item.assignThread(threadName);
        metricsService.incrementStarted();
        long startedAt = System.nanoTime();
        log.info("Начало загрузки: id={}, thread={}, url={}", item.getId(), threadName, item.getUrl());

        try {
            MediaRecord record = ingestService.ingest(item.getUrl(), item.getOptions(), progress -> {
                item.updateProgress(progress);
                notifyListeners(item, listener -> listener.onProgress(item));
            }, token);

            item.markAsCompleted(record);
            metricsService.incrementCompleted();
            log.info("Загрузка завершена: id={}, recordId={}", item.getId(), record.getId());
            notifyListeners(item, listener -> listener.onComplete(item));
        } catch (IngestCancelledException e) {
            markCancelled(item);
        } catch (RuntimeException e) {
            if (token.isCancelled()) {
                log.debug("Ошибка после отмены загрузки id={}: {}", item.getId(), e.getMessage());
                markCancelled(item);
            } else {
                markFailed(item, e);
            }
        } finally {
            metricsService.recordIngestTime(Duration.ofNanos(System.nanoTime() - startedAt));
            tokens.remove(item.getId());
            permits.release();
            MDC.remove(MDC_ITEM_ID);
        }
    }

    private void markCancelled(QueueItem item) {
        item.markAsCancelled();
        metricsService.incrementCancelled();
        log.info("Загрузка отменена: id={}", item.getId());
        notifyListeners(item, listener -> listener.onCancelled(item));
    }

    private void markFailed(QueueItem item, RuntimeException e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            message = e.getClass().getSimpleName();
        }
        if (e instanceof DuplicateMediaException duplicate) {
            metricsService.incrementDuplicates(duplicate.getKind());
            log.info("Дубликат: id={}, kind={}, existingId={}",
                    item.getId(), duplicate.getKind(), duplicate.getExistingRecordId());
        } else if (e instanceof IngestException) {
            log.warn("Загрузка не удалась: id={}, error={}", item.getId(), message);
        } else {
            log.error("Непредвиденная ошибка загрузки: id={}", item.getId(), e);
        }
        item.markAsFailed(message);
        metricsService.incrementFailed();
        notifyListeners(item, listener -> listener.onError(item));
    }

    private void notifyListeners(QueueItem item, Consumer<AcquisitionListener> event) {
        for (AcquisitionListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("Ошибка в слушателе очереди для id={}", item.getId(), e);
            }
        }
    }

    private int removeWhere(Predicate<QueueItem> condition) {
        int removed = 0;
        for (QueueItem item : new ArrayList<>(items.values())) {
            if (condition.test(item) && items.remove(item.getId(), item)) {
                removed++;
            }
        }
        return removed;
    }

    private int countByStatus(QueueStatus status) {
        return (int) items.values().stream()
                .filter(item -> item.getStatus() == status)
                .count();
    }
}
