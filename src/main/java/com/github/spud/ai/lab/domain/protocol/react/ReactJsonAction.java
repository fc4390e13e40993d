package com.github.spud.ai.lab.domain.protocol.react;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Action half of a ReAct step.
 * <p>
 * {@code tool} calls one tool, {@code final} closes the turn with an answer, {@code none} asks for
 * another step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReactJsonAction {

  public static final String TOOL = "tool";
  public static final String FINAL = "final";
  public static final String NONE = "none";

  private String type;

  /**
   * Tool name, only for {@code tool}
   */
  private String name;

  /**
   * Raw JSON arguments, only for {@code tool}
   */
  private JsonNode args;

  /**
   * Turn content, only for {@code final}
   */
  private String answer;

  public String normalizedType() {
    return type == null ? "" : type.trim().toLowerCase();
  }

  public void validate() {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("Action type is required");
    }

    switch (normalizedType()) {
      case TOOL:
        if (name == null || name.isBlank()) {
          throw new IllegalArgumentException("Tool name is required for action type 'tool'");
        }
        if (args == null || !args.isObject()) {
          throw new IllegalArgumentException("Tool args must be a JSON object for action type 'tool'");
        }
        break;
      case FINAL:
        if (answer == null || answer.isBlank()) {
          throw new IllegalArgumentException("Answer is required for action type 'final'");
        }
        break;
      case NONE:
        break;
      default:
        throw new IllegalArgumentException("Unknown action type: " + type +
          ". Expected: tool, final, or none");
    }
  }
}
