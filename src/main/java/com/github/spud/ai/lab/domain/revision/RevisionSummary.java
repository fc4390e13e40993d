package com.github.spud.ai.lab.domain.revision;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Record of a single revision-cycle transition.
 */
@Value
@Builder
public class RevisionSummary {

  String cycleId;

  /**
   * Leading part of the plan under implementation
   */
  String task;

  RevisionState from;

  RevisionState to;

  RevisionEvent event;

  RevisionVerdict verdict;

  String rationale;

  int revision;

  @Builder.Default
  Instant timestamp = Instant.now();

  public String toNotebookBody() {
    return "Revision cycle " + cycleId + " (revision " + revision + "): " + from + " -> " + to
      + " on " + event + "\nVerdict: " + verdict
      + "\nRationale: " + (rationale == null || rationale.isBlank() ? "-" : rationale)
      + "\nTask: " + task;
  }
}
