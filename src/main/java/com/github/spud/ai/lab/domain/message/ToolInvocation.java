package com.github.spud.ai.lab.domain.message;

import lombok.Builder;
import lombok.Value;

/**
 * One tool call issued during a turn, with its result or error.
 */
@Value
@Builder
public class ToolInvocation {

  String toolName;

  /**
   * Raw JSON arguments as sent by the agent.
   */
  String arguments;

  String result;

  String error;

  long durationMs;

  boolean timedOut;

  public boolean isSuccess() {
    return error == null;
  }

  public static ToolInvocation success(String toolName, String arguments, String result,
    long durationMs) {
    return ToolInvocation.builder()
      .toolName(toolName)
      .arguments(arguments)
      .result(result != null ? result : "")
      .durationMs(durationMs)
      .build();
  }

  public static ToolInvocation failure(String toolName, String arguments, String error,
    long durationMs) {
    return ToolInvocation.builder()
      .toolName(toolName)
      .arguments(arguments)
      .error(error != null ? error : "Unknown error")
      .durationMs(durationMs)
      .build();
  }

  public static ToolInvocation timeout(String toolName, String arguments, long durationMs) {
    return ToolInvocation.builder()
      .toolName(toolName)
      .arguments(arguments)
      .error("Tool '" + toolName + "' timed out after " + durationMs + "ms")
      .durationMs(durationMs)
      .timedOut(true)
      .build();
  }
}
