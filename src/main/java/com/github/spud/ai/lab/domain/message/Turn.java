package com.github.spud.ai.lab.domain.message;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A single authored turn. Immutable once built; tool calls stay in issue order.
 */
@Value
@Builder(toBuilder = true)
public class Turn {

  String author;

  String content;

  @Singular
  List<ToolInvocation> toolCalls;

  @Builder.Default
  Instant timestamp = Instant.now();

  public List<ToolInvocation> failedToolCalls() {
    return toolCalls.stream().filter(call -> !call.isSuccess()).toList();
  }

  /**
   * Returns a turn whose content mentions every failed tool call. Failures the author already
   * quoted are left alone.
   */
  public Turn withSurfacedToolFailures() {
    String text = content != null ? content : "";
    StringBuilder sb = new StringBuilder(text);
    for (ToolInvocation failed : failedToolCalls()) {
      if (!text.contains(failed.getError())) {
        if (sb.length() > 0) {
          sb.append('\n');
        }
        sb.append("[tool error] ").append(failed.getToolName()).append(": ")
          .append(failed.getError());
      }
    }
    String surfaced = sb.toString();
    return surfaced.equals(content) ? this : toBuilder().content(surfaced).build();
  }
}
