package com.github.spud.ai.lab.domain.orchestrator;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RunResult {

  private String runId;

  private RunStatus status;

  /**
   * Human-readable cause of the status
   */
  private String reason;

  private int iterations;

  private String lastPlan;

  private String lastReport;

  private List<IterationRecord> iterationRecords;

  private String error;

  private Instant startTime;

  private Instant endTime;

  public static RunResult fromState(String runId, OrchestratorState state, RunStatus status,
    String reason, Instant startTime) {
    return RunResult.builder()
      .runId(runId)
      .status(status)
      .reason(reason)
      .iterations(state.getIteration())
      .lastPlan(state.getLastPlan())
      .lastReport(state.getLastReport())
      .iterationRecords(List.copyOf(state.getRecords()))
      .startTime(startTime)
      .endTime(Instant.now())
      .build();
  }

  public static RunResult error(String runId, OrchestratorState state, Throwable error,
    Instant startTime) {
    RunResult result = fromState(runId, state, RunStatus.FAILED,
      error.getClass().getSimpleName(), startTime);
    result.setError(error.getMessage());
    return result;
  }

  public boolean isSuccess() {
    return status == RunStatus.SUCCESS;
  }
}
