package com.github.spud.ai.lab.domain.orchestrator;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Run-level state. Only {@link LabOrchestrator} reads or writes it.
 */
@Data
@Builder
public class OrchestratorState {

  private int iteration;

  private int maxIterations;

  private boolean terminal;

  private String lastPlan;

  private String lastReport;

  @Builder.Default
  private List<IterationRecord> records = new ArrayList<>();

  public boolean budgetLeft() {
    return iteration < maxIterations;
  }
}
