package com.sandy.debrisflow.monitor;

import com.sandy.debrisflow.monitor.exception.ExecutorException;
import com.sandy.debrisflow.monitor.executor.ExecutorPollResult;
import com.sandy.debrisflow.monitor.executor.ExecutorStatus;
import com.sandy.debrisflow.monitor.executor.SimulationExecutor;
import com.sandy.debrisflow.monitor.executor.SimulationMetrics;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted executor for the test profile. Runs stay RUNNING until a test completes or fails them.
 */
@Service
@Profile("test")
public class InMemorySimulationExecutor implements SimulationExecutor {

    private final AtomicInteger seq = new AtomicInteger();
    private final Map<String, ExecutorPollResult> results = new ConcurrentHashMap<>();
    private final List<String> submitted = new CopyOnWriteArrayList<>();
    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();
    private volatile String submitError;
    private volatile String pollError;

    @Override
    public String submit(String parametersJson, String modelName, String modelVersion) {
        if (submitError != null) {
            throw new ExecutorException(submitError);
        }
        String id = "ext-" + seq.incrementAndGet();
        submitted.add(id);
        results.put(id, ExecutorPollResult.running());
        return id;
    }

    @Override
    public ExecutorPollResult poll(String externalRunId) {
        if (pollError != null) {
            throw new ExecutorException(pollError);
        }
        ExecutorPollResult r = results.get(externalRunId);
        if (r == null) {
            throw new ExecutorException("Unknown run " + externalRunId);
        }
        return r;
    }

    @Override
    public void cancel(String externalRunId) {
        cancelled.add(externalRunId);
        results.computeIfPresent(externalRunId, (k, v) -> v.getStatus().isTerminal() ? v
                : ExecutorPollResult.builder().status(ExecutorStatus.CANCELLED).errorMessage("cancelled").build());
    }

    public void complete(String externalRunId, SimulationMetrics metrics) {
        results.put(externalRunId, ExecutorPollResult.builder()
                .status(ExecutorStatus.COMPLETED)
                .outputPath("/runs/" + externalRunId)
                .metrics(metrics)
                .build());
    }

    public void fail(String externalRunId, String message) {
        results.put(externalRunId, ExecutorPollResult.builder().status(ExecutorStatus.FAILED).errorMessage(message).build());
    }

    public void failSubmissions(String message) { this.submitError = message; }

    public void failPolls(String message) { this.pollError = message; }

    public List<String> submitted() { return submitted; }

    public boolean wasCancelled(String externalRunId) { return cancelled.contains(externalRunId); }

    public void reset() {
        results.clear();
        submitted.clear();
        cancelled.clear();
        submitError = null;
        pollError = null;
    }
}
