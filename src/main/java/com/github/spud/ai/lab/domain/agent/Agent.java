package com.github.spud.ai.lab.domain.agent;

import com.github.spud.ai.lab.domain.message.Transcript;
import com.github.spud.ai.lab.domain.message.Turn;

/**
 * A role-bound participant. Implementations keep no state between turns: everything a turn needs
 * arrives through the transcript and the task context.
 */
public interface Agent {

  RoleConfig getRole();

  default String getId() {
    return getRole().getId();
  }

  /**
   * Produces exactly one turn authored by this agent.
   *
   * @throws FatalAgentException when the model cannot be reached or times out
   */
  Turn takeTurn(Transcript transcript, String taskContext);
}
