package com.github.spud.ai.lab.domain.agent;

/**
 * Which turn behavior a role gets.
 */
public enum AgentKind {
  /**
   * Planning members and the critic: short micro-loop, any final answer ends the turn
   */
  DISCUSSION,

  /**
   * Implementation engineer: long micro-loop, the final answer must carry a completion token
   */
  ENGINEER
}
