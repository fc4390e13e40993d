package com.github.spud.ai.lab.domain.orchestrator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Terminal status of a research run and the process exit code it maps to.
 */
@Getter
@RequiredArgsConstructor
public enum RunStatus {
  /**
   * The planning lead declared the project finished
   */
  SUCCESS(0),

  /**
   * A notebook write or a model call failed
   */
  FAILED(1),

  /**
   * Outer iteration budget used up without completion
   */
  INCOMPLETE(2),

  /**
   * The planning discussion hit its turn cap
   */
  ABORTED(3);

  private final int exitCode;
}
