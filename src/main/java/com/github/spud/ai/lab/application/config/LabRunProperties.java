package com.github.spud.ai.lab.application.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Loop bounds and locations for a research run.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "lab.run")
public class LabRunProperties {

  /**
   * Planning + implementation rounds before the run ends INCOMPLETE
   */
  @Min(1)
  private int maxOuterIterations = 25;

  /**
   * Critic REVISE verdicts tolerated per cycle; the engineer runs at most this plus one times
   */
  @Min(0)
  private int maxRevisions = 3;

  /**
   * Turn cap of the planning round-robin
   */
  @Min(1)
  private int planningMaxTurns = 15;

  /**
   * Directory where the engineer writes scripts, plots and models
   */
  @NotBlank
  private String outputDir = "output";

  @NotBlank
  private String notebookPath = "output/lab_notebook.jsonl";

  /**
   * Character cap of the notebook history shown to the planning team
   */
  @Min(1000)
  private int notebookCharLimit = 100_000;

  /**
   * Messages of a revision cycle kept in the implementation report
   */
  @Min(1)
  private int reportMessageLimit = 25;

  /**
   * Wall-clock ceiling for a single model call
   */
  private Duration generationTimeout = Duration.ofMinutes(3);

  /**
   * Also write one NOTE per revision transition
   */
  private boolean persistTransitions = false;

  /**
   * Use the in-memory notebook instead of the JSON-lines file
   */
  private boolean inMemoryNotebook = false;
}
