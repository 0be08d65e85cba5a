package com.example.medialibrary.service;

import com.example.medialibrary.model.DuplicateKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.function.Supplier;

@Service
@Slf4j
public class MetricsService {

    private final MeterRegistry meterRegistry;
    private final ThreadPoolExecutor ingestExecutor;

    private final Counter itemsSubmittedCounter;
    private final Counter itemsStartedCounter;
    private final Counter itemsCompletedCounter;
    private final Counter itemsFailedCounter;
    private final Counter itemsCancelledCounter;
    private final Map<DuplicateKind, Counter> duplicateCounters = new EnumMap<>(DuplicateKind.class);
    private final Timer ingestTimer;

    public MetricsService(MeterRegistry meterRegistry, @Qualifier("ingestExecutor") ThreadPoolExecutor ingestExecutor) {
        this.meterRegistry = meterRegistry;
        this.ingestExecutor = ingestExecutor;

        this.itemsSubmittedCounter = Counter.builder("media.ingest.submitted")
                .description("Количество URL, поставленных в очередь")
                .register(meterRegistry);

        this.itemsStartedCounter = Counter.builder("media.ingest.started")
                .description("Количество начатых загрузок")
                .register(meterRegistry);

        this.itemsCompletedCounter = Counter.builder("media.ingest.completed")
                .description("Количество записей, добавленных в библиотеку")
                .register(meterRegistry);

        this.itemsFailedCounter = Counter.builder("media.ingest.failed")
                .description("Количество неудачных загрузок")
                .register(meterRegistry);

        this.itemsCancelledCounter = Counter.builder("media.ingest.cancelled")
                .description("Количество отмененных загрузок")
                .register(meterRegistry);

        for (DuplicateKind kind : DuplicateKind.values()) {
            duplicateCounters.put(kind, Counter.builder("media.ingest.duplicates")
                    .description("Количество отклоненных дубликатов")
                    .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }

        this.ingestTimer = Timer.builder("media.ingest.duration")
                .description("Время загрузки от старта до записи в библиотеку")
                .register(meterRegistry);

        meterRegistry.gauge("media.ingest.pool.active",
                ingestExecutor,
                ThreadPoolExecutor::getActiveCount);

        meterRegistry.gauge("media.ingest.pool.size",
                ingestExecutor,
                ThreadPoolExecutor::getPoolSize);

        meterRegistry.gauge("media.ingest.pool.completed.tasks",
                ingestExecutor,
                ThreadPoolExecutor::getCompletedTaskCount);

        log.info("Метрики инициализированы");
    }

    public void registerQueueGauges(Supplier<Number> pending, Supplier<Number> running) {
        Gauge.builder("media.queue.pending", pending)
                .description("Элементы очереди, ожидающие запуска")
                .register(meterRegistry);
        Gauge.builder("media.queue.running", running)
                .description("Выполняющиеся загрузки")
                .register(meterRegistry);
    }

    public void incrementSubmitted() {
        itemsSubmittedCounter.increment();
        log.debug("Инкремент счетчика поставленных в очередь");
    }

    public void incrementStarted() {
        itemsStartedCounter.increment();
        log.debug("Инкремент счетчика начатых загрузок");
    }

    public void incrementCompleted() {
        itemsCompletedCounter.increment();
        log.debug("Инкремент счетчика завершенных загрузок");
    }

    public void incrementFailed() {
        itemsFailedCounter.increment();
        log.debug("Инкремент счетчика неудачных загрузок");
    }

    public void incrementCancelled() {
        itemsCancelledCounter.increment();
        log.debug("Инкремент счетчика отмененных загрузок");
    }

    public void incrementDuplicates(DuplicateKind kind) {
        duplicateCounters.get(kind).increment();
        log.debug("Инкремент счетчика дубликатов: kind={}", kind);
    }

    public void recordIngestTime(Duration duration) {
        ingestTimer.record(duration);
        log.debug("Записано время загрузки: {} мс", duration.toMillis());
    }

    public double getSubmittedCount() {
        return itemsSubmittedCounter.count();
    }

    public double getCompletedCount() {
        return itemsCompletedCounter.count();
    }

    public double getFailedCount() {
        return itemsFailedCounter.count();
    }

    public double getCancelledCount() {
        return itemsCancelledCounter.count();
    }

    public double getDuplicateCount(DuplicateKind kind) {
        return duplicateCounters.get(kind).count();
    }

    public int getActiveThreadCount() {
        return ingestExecutor.getActiveCount();
    }
}
