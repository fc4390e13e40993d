package com.github.spud.ai.lab.domain.protocol.react;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One model step: {@code {"thought": "...", "action": {"type": "tool|final|none", ...}}}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReactJsonStep {

  private String thought;

  private ReactJsonAction action;

  public void validate() {
    if (action == null) {
      throw new IllegalArgumentException("Action is required in ReactJsonStep");
    }
    action.validate();
  }
}
