package com.github.spud.ai.lab.application.runner;

import com.github.spud.ai.lab.domain.orchestrator.IterationRecord;
import com.github.spud.ai.lab.domain.orchestrator.LabOrchestrator;
import com.github.spud.ai.lab.domain.orchestrator.RunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one research run at startup and exposes its status as the process exit code.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "lab.runner.enabled", havingValue = "true")
public class ResearchRunCliRunner implements ApplicationRunner, ExitCodeGenerator {

  private final LabOrchestrator labOrchestrator;

  private volatile RunResult result;

  @Override
  public void run(ApplicationArguments args) {
    result = labOrchestrator.run();
    log.info("Run {} finished: status={}, iterations={}, reason={}", result.getRunId(),
      result.getStatus(), result.getIterations(), result.getReason());
    for (IterationRecord record : result.getIterationRecords()) {
      log.info("  iteration {}: planning={} ({} turns), revision={} ({} revisions), {}ms",
        record.getIteration(), record.getPlanningOutcome(), record.getPlanningTurns(),
        record.getRevisionOutcome(), record.getRevisionCount(), record.getDurationMs());
    }
    if (result.getError() != null) {
      log.error("Run {} error: {}", result.getRunId(), result.getError());
    }
  }

  @Override
  public int getExitCode() {
    return result == null ? 0 : result.getStatus().getExitCode();
  }

  public RunResult getResult() {
    return result;
  }
}
