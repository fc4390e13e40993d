package com.github.spud.ai.lab.domain.chat;

public enum SubChatOutcome {
  /**
   * Closer emitted a stop token; the output goes to the next team
   */
  HANDOFF,

  /**
   * Closer declared the whole project finished
   */
  FINAL,

  /**
   * Turn cap reached without a stop from the closer
   */
  ROUND_CAP_EXCEEDED
}
