package com.sandy.debrisflow.monitor.executor;

/**
 * Port to the external debris-flow model. Implementations must not block for the duration of a run:
 * {@link #submit} returns as soon as the executor has accepted the job.
 */
public interface SimulationExecutor {

    /**
     * @return the executor's identifier for the new run
     * @throws com.sandy.debrisflow.monitor.exception.ExecutorException if the executor refuses or is unreachable
     */
    String submit(String parametersJson, String modelName, String modelVersion);

    ExecutorPollResult poll(String externalRunId);

    /** Best-effort cancellation signal. */
    void cancel(String externalRunId);
}
