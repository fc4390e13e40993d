package com.github.spud.ai.lab.domain.revision;

public enum RevisionEvent {
  /**
   * Engineer turn carried its completion token
   */
  ENGINEER_DONE,

  /**
   * Engineer ran out of micro-steps without the completion token
   */
  ENGINEER_BUDGET_EXHAUSTED,

  CRITIC_APPROVE,

  CRITIC_REVISE,

  /**
   * Another implementation round is allowed
   */
  RESUME_IMPLEMENTATION,

  /**
   * Revision count reached the cycle's maximum
   */
  REVISION_BUDGET_EXHAUSTED
}
