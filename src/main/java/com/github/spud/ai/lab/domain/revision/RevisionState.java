package com.github.spud.ai.lab.domain.revision;

/**
 * States of one engineer / critic cycle.
 */
public enum RevisionState {
  IMPLEMENTING,
  AWAITING_REVIEW,
  REVISION_REQUESTED,
  APPROVED,
  ABORTED;

  public static boolean isFinal(RevisionState state) {
    return state == APPROVED || state == ABORTED;
  }
}
