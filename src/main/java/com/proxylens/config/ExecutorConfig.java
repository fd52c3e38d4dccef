package com.proxylens.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Worker pools for background ingestion and detection.
 *
 * The pools are separate so a long ingest never delays detection of another
 * upload. Both use bounded queues; a full queue rejects new work instead of
 * growing without limit.
 */
@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    @Value("${proxylens.ingest.pool-size:4}")
    private int ingestPoolSize;

    @Value("${proxylens.ingest.queue-capacity:100}")
    private int ingestQueueCapacity;

    @Value("${proxylens.detection.pool-size:2}")
    private int detectionPoolSize;

    @Value("${proxylens.detection.queue-capacity:100}")
    private int detectionQueueCapacity;

    @Bean(name = "ingestExecutor", destroyMethod = "shutdown")
    public ExecutorService ingestExecutor() {
        log.info("Ingest executor: {} threads, queue {}", ingestPoolSize, ingestQueueCapacity);
        return newPool("ingest-%d", ingestPoolSize, ingestQueueCapacity);
    }

    @Bean(name = "detectionExecutor", destroyMethod = "shutdown")
    public ExecutorService detectionExecutor() {
        log.info("Detection executor: {} threads, queue {}", detectionPoolSize, detectionQueueCapacity);
        return newPool("detection-%d", detectionPoolSize, detectionQueueCapacity);
    }

    private static ExecutorService newPool(String nameFormat, int threads, int queueCapacity) {
        return new ThreadPoolExecutor(
            threads,
            threads,
            60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(queueCapacity),
            new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(false).build(),
            new ThreadPoolExecutor.AbortPolicy());
    }
}
