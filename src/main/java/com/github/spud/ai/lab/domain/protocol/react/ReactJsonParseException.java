package com.github.spud.ai.lab.domain.protocol.react;

import lombok.Getter;

/**
 * Model output that could not be read as a ReAct step.
 */
@Getter
public class ReactJsonParseException extends Exception {

  private final String originalText;
  private final String reason;

  public ReactJsonParseException(String reason, String originalText) {
    super("Failed to parse ReAct JSON: " + reason);
    this.reason = reason;
    this.originalText = originalText;
  }

  public ReactJsonParseException(String reason, String originalText, Throwable cause) {
    super("Failed to parse ReAct JSON: " + reason, cause);
    this.reason = reason;
    this.originalText = originalText;
  }

}
