package com.sandy.debrisflow.monitor.service;

import com.sandy.debrisflow.monitor.entity.FailureCause;
import com.sandy.debrisflow.monitor.entity.RiskZone;
import com.sandy.debrisflow.monitor.entity.SimulationRun;
import com.sandy.debrisflow.monitor.entity.SimulationStatus;
import com.sandy.debrisflow.monitor.event.SimulationRunCompletedEvent;
import com.sandy.debrisflow.monitor.event.SimulationRunFailedEvent;
import com.sandy.debrisflow.monitor.exception.ExecutorException;
import com.sandy.debrisflow.monitor.exception.ResourceNotFoundException;
import com.sandy.debrisflow.monitor.exception.ValidationException;
import com.sandy.debrisflow.monitor.executor.ExecutorPollResult;
import com.sandy.debrisflow.monitor.executor.SimulationExecutor;
import com.sandy.debrisflow.monitor.executor.SimulationMetrics;
import com.sandy.debrisflow.monitor.repository.RiskZoneRepository;
import com.sandy.debrisflow.monitor.repository.SimulationRunRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives simulation runs through their lifecycle: submits PENDING runs, polls RUNNING ones,
 * applies terminal results and enforces the wall-clock timeout. Runs are never retried.
 */
@Service
@Slf4j
public class SimulationSupervisor {

    private final SimulationRunRepository runRepository;
    private final RiskZoneRepository riskZoneRepository;
    private final SimulationExecutor executor;
    private final RiskZoneFactory riskZoneFactory;
    private final SimulationRunLocks runLocks;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Value("${simulation.timeout:PT1H}")
    private Duration timeout;
    @Value("${simulation.supervisor.enabled:true}")
    private boolean enabled;

    public SimulationSupervisor(SimulationRunRepository runRepository,
                                RiskZoneRepository riskZoneRepository,
                                SimulationExecutor executor,
                                RiskZoneFactory riskZoneFactory,
                                SimulationRunLocks runLocks,
                                ApplicationEventPublisher eventPublisher,
                                PlatformTransactionManager transactionManager,
                                Clock clock) {
        this.runRepository = runRepository;
        this.riskZoneRepository = riskZoneRepository;
        this.executor = executor;
        this.riskZoneFactory = riskZoneFactory;
        this.runLocks = runLocks;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        log.info("Simulation supervisor initialized: enabled={} timeout={} executor={}",
                enabled, timeout, executor.getClass().getSimpleName());
    }

    @Scheduled(fixedDelayString = "${simulation.supervisor.interval-ms:10000}")
    public void scheduledSupervise() {
        if (!enabled) return;
        try {
            superviseOnce(LocalDateTime.now(clock));
        } catch (Exception e) {
            log.error("Simulation supervision pass failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One supervision pass as of {@code now}.
     */
    public void superviseOnce(LocalDateTime now) {
        for (SimulationRun pending : runRepository.findByStatusOrderByCreatedAtAsc(SimulationStatus.PENDING)) {
            withRunLock(pending.getId(), () -> submit(pending.getId(), now));
        }
        for (SimulationRun running : runRepository.findByStatusOrderByCreatedAtAsc(SimulationStatus.RUNNING)) {
            withRunLock(running.getId(), () -> pollOrExpire(running.getId(), now));
        }
    }

    /**
     * Cooperative cancellation: the executor is signalled and the run is marked FAILED.
     */
    public SimulationRun cancel(Long runId, String operator) {
        ReentrantLock lock = runLocks.lockFor(runId);
        lock.lock();
        try {
            SimulationRun run = runRepository.findById(runId)
                    .orElseThrow(() -> new ResourceNotFoundException("simulation run", runId));
            if (run.getStatus().isTerminal()) {
                throw new ValidationException("Simulation run " + runId + " is already " + run.getStatus());
            }
            if (run.getExternalRunId() != null) {
                try {
                    executor.cancel(run.getExternalRunId());
                } catch (ExecutorException e) {
                    log.warn("Executor did not acknowledge cancellation of run id={}: {}", runId, e.getMessage());
                }
            }
            return fail(run, FailureCause.CANCELLED, "Cancelled by " + (operator != null ? operator : "operator"),
                    LocalDateTime.now(clock));
        } finally {
            lock.unlock();
            runLocks.release(runId);
        }
    }

    private void withRunLock(Long runId, Runnable action) {
        ReentrantLock lock = runLocks.lockFor(runId);
        lock.lock();
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Supervision of run id={} failed", runId, e);
        } finally {
            lock.unlock();
        }
        runRepository.findById(runId)
                .filter(r -> r.getStatus().isTerminal())
                .ifPresent(r -> runLocks.release(runId));
    }

    private void submit(Long runId, LocalDateTime now) {
        SimulationRun run = runRepository.findById(runId).orElse(null);
        if (run == null || run.getStatus() != SimulationStatus.PENDING) {
            return;
        }
        if (expired(run, now)) {
            fail(run, FailureCause.TIMEOUT, "Not submitted within " + timeout, now);
            return;
        }
        String externalRunId;
        try {
            externalRunId = executor.submit(run.getParametersJson(), run.getModelName(), run.getModelVersion());
        } catch (ExecutorException e) {
            fail(run, FailureCause.EXECUTOR_ERROR, e.getMessage(), now);
            return;
        }
        run.transitionTo(SimulationStatus.RUNNING);
        run.setExternalRunId(externalRunId);
        run.setStartedAt(now);
        runRepository.save(run);
        log.info("Simulation run submitted id={} externalRunId={}", runId, externalRunId);
    }

    private void pollOrExpire(Long runId, LocalDateTime now) {
        SimulationRun run = runRepository.findById(runId).orElse(null);
        if (run == null || run.getStatus() != SimulationStatus.RUNNING) {
            return;
        }
        if (expired(run, now)) {
            try {
                executor.cancel(run.getExternalRunId());
            } catch (ExecutorException e) {
                log.warn("Cancel signal for timed-out run id={} failed: {}", runId, e.getMessage());
            }
            fail(run, FailureCause.TIMEOUT, "Exceeded timeout of " + timeout, now);
            return;
        }
        ExecutorPollResult result;
        try {
            result = executor.poll(run.getExternalRunId());
        } catch (ExecutorException e) {
            fail(run, FailureCause.EXECUTOR_ERROR, e.getMessage(), now);
            return;
        }
        if (result == null || result.getStatus() == null || !result.getStatus().isTerminal()) {
            return;
        }
        switch (result.getStatus()) {
            case COMPLETED -> complete(run, result, now);
            case CANCELLED -> fail(run, FailureCause.CANCELLED,
                    result.getErrorMessage() != null ? result.getErrorMessage() : "Cancelled by executor", now);
            default -> fail(run, FailureCause.EXECUTOR_ERROR,
                    result.getErrorMessage() != null ? result.getErrorMessage() : "Executor reported failure", now);
        }
    }

    private void complete(SimulationRun run, ExecutorPollResult result, LocalDateTime now) {
        SimulationMetrics m = result.getMetrics() != null ? result.getMetrics() : new SimulationMetrics();
        RiskZone zone;
        try {
            zone = transactionTemplate.execute(status -> {
                run.transitionTo(SimulationStatus.COMPLETED);
                run.setOutputPath(result.getOutputPath());
                run.setRunoutAreaM2(m.getRunoutAreaM2());
                run.setMaxRunoutDistanceM(m.getMaxRunoutDistanceM());
                run.setAffectedVolumeM3(m.getAffectedVolumeM3());
                run.setMaxVelocityMs(m.getMaxVelocityMs());
                run.setComputationTimeS(m.getComputationTimeS());
                run.setCompletedAt(now);
                SimulationRun saved = runRepository.save(run);
                return riskZoneRepository.save(riskZoneFactory.build(saved, m, now));
            });
        } catch (RuntimeException e) {
            // nothing was committed; the run is still RUNNING in the store
            log.error("Could not materialise risk zone for run id={}", run.getId(), e);
            SimulationRun reloaded = runRepository.findById(run.getId()).orElseThrow();
            fail(reloaded, FailureCause.EXECUTOR_ERROR, "Unusable executor output: " + e.getMessage(), now);
            return;
        }
        log.info("Simulation run completed id={} zoneId={} level={} value={}",
                run.getId(), zone.getId(), zone.getRiskLevel(), String.format("%.3f", zone.getRiskValue()));
        eventPublisher.publishEvent(new SimulationRunCompletedEvent(run.getId(), run.getRainfallEventId(),
                zone.getId(), zone.getRiskLevel()));
    }

    private SimulationRun fail(SimulationRun run, FailureCause cause, String message, LocalDateTime now) {
        run.transitionTo(SimulationStatus.FAILED);
        run.setFailureCause(cause);
        run.setErrorMessage(truncate(message));
        run.setCompletedAt(now);
        SimulationRun saved = runRepository.save(run);
        log.warn("Simulation run failed id={} cause={} message={}", saved.getId(), cause, saved.getErrorMessage());
        eventPublisher.publishEvent(new SimulationRunFailedEvent(saved.getId(), saved.getRainfallEventId(), cause,
                saved.getErrorMessage()));
        return saved;
    }

    // measured from submission, or from creation while still pending
    private boolean expired(SimulationRun run, LocalDateTime now) {
        LocalDateTime reference = run.getStartedAt() != null ? run.getStartedAt() : run.getCreatedAt();
        return reference != null && !now.isBefore(reference.plus(timeout));
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() <= 2000 ? s : s.substring(0, 2000);
    }
}
