package com.example.medialibrary.model;

import com.example.medialibrary.exception.IngestCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one ingest run. The run checks it between steps; long blocking
 * calls register a callback that is fired once when the token is cancelled.
 */
@Slf4j
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            // exactly one of cancel/onCancel removes and runs each callback
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new IngestCancelledException("Загрузка отменена");
        }
    }

    /**
     * Registers a callback. If the token is already cancelled the callback runs immediately.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runCallback(callback);
        }
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Ошибка в обработчике отмены: {}", e.getMessage(), e);
        }
    }
}
