package com.example.medialibrary.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class ThreadPoolConfig {

    @Value("${media-library.thread-pool.keep-alive-seconds:60}")
    private int keepAliveSeconds;

    /**
     * Worker pool for ingest runs, sized to the acquisition queue's permit count.
     */
    @Bean(name = "ingestExecutor", destroyMethod = "")
    public ThreadPoolExecutor ingestExecutor(MediaLibraryProperties properties) {
        int size = properties.getQueue().getMaxConcurrent();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                size,
                size,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactory() {
                    private final AtomicInteger counter = new AtomicInteger();
                    @Override
                    public Thread newThread(Runnable r) {
                        Thread thread = new Thread(r, "ingest-worker-" + counter.incrementAndGet());
                        thread.setDaemon(false);
                        return thread;
                    }
                },
                new ThreadPoolExecutor.AbortPolicy()
        );

        executor.allowCoreThreadTimeOut(true);

        log.info("Создан ThreadPoolExecutor для загрузок: size={}, keepAlive={}s", size, keepAliveSeconds);

        return executor;
    }
}
