package com.sandy.debrisflow.monitor.executor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutorPollResult {
    private ExecutorStatus status;
    private String outputPath;
    private SimulationMetrics metrics;
    private String errorMessage;

    public static ExecutorPollResult running() {
        return ExecutorPollResult.builder().status(ExecutorStatus.RUNNING).build();
    }
}
