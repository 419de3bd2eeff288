package com.sandy.debrisflow.monitor.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Bounded pool of single-thread workers. Every task for a given location runs on the same
 * worker, so ingestion and event-state updates for one location are strictly serialized while
 * different locations proceed in parallel.
 */
@Component
@Slf4j
public class LocationWorkerPool {

    @Value("${ingestion.worker-threads:4}")
    private int workerThreads;

    private ExecutorService[] workers;

    @PostConstruct
    public void init() {
        int n = Math.max(1, workerThreads);
        workers = new ExecutorService[n];
        for (int i = 0; i < n; i++) {
            workers[i] = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("location-worker-" + i + "-"));
        }
        log.info("Location worker pool started: workers={}", n);
    }

    @PreDestroy
    public void shutdown() {
        for (ExecutorService w : workers) {
            w.shutdown();
        }
        for (ExecutorService w : workers) {
            try {
                if (!w.awaitTermination(5, TimeUnit.SECONDS)) {
                    w.shutdownNow();
                }
            } catch (InterruptedException e) {
                w.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public <T> Future<T> submit(Long locationId, Callable<T> task) {
        return workers[stripe(locationId)].submit(task);
    }

    int stripe(Long locationId) {
        return Math.floorMod(Long.hashCode(locationId), workers.length);
    }
}
