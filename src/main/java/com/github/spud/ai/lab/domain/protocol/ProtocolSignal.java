package com.github.spud.ai.lab.domain.protocol;

/**
 * Control signals carried by protocol tokens in free-text turns.
 */
public enum ProtocolSignal {
  /**
   * No recognized token
   */
  NONE,

  /**
   * Closer ends the discussion and hands the plan to the next team
   */
  HANDOFF,

  /**
   * Closer declares the entire project finished
   */
  FINAL,

  /**
   * Engineer reports its implementation complete
   */
  DONE,

  /**
   * Critic approves the implementation
   */
  APPROVE,

  /**
   * Critic requests another revision
   */
  REVISE
}
