package com.sandy.debrisflow.monitor.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per simulation run, shared by the supervisor and operator cancellation so a run is never
 * finished and cancelled at the same time.
 */
@Component
public class SimulationRunLocks {

    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(Long runId) {
        return locks.computeIfAbsent(runId, id -> new ReentrantLock());
    }

    /** Drops the lock of a run that reached a terminal status. */
    public void release(Long runId) {
        locks.computeIfPresent(runId, (id, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }

    int size() {
        return locks.size();
    }
}
