package com.github.spud.ai.lab.domain.orchestrator;

import com.github.spud.ai.lab.domain.chat.SubChatOutcome;
import com.github.spud.ai.lab.domain.revision.RevisionState;
import lombok.Builder;
import lombok.Value;

/**
 * What happened in one outer iteration. Revision fields stay null when the implementation team
 * did not run.
 */
@Value
@Builder
public class IterationRecord {

  int iteration;

  SubChatOutcome planningOutcome;

  int planningTurns;

  RevisionState revisionOutcome;

  Integer revisionCount;

  long durationMs;
}
