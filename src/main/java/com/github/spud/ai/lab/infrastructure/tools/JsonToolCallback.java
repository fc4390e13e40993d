package com.github.spud.ai.lab.infrastructure.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.ai.lab.util.JsonUtils;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.tool.execution.ToolExecutionException;

/**
 * Local tool whose input is a JSON object. Handler failures propagate so the gateway can record
 * them as structured errors; checked exceptions are wrapped in {@link ToolExecutionException}.
 */
final class JsonToolCallback implements ToolCallback {

  @FunctionalInterface
  interface Handler {

    String handle(JsonNode args) throws Exception;
  }

  private final ToolDefinition definition;
  private final Handler handler;

  private JsonToolCallback(ToolDefinition definition, Handler handler) {
    this.definition = definition;
    this.handler = handler;
  }

  static JsonToolCallback of(String name, String description, String inputSchema,
    Handler handler) {
    ToolDefinition definition = DefaultToolDefinition.builder()
      .name(name)
      .description(description)
      .inputSchema(inputSchema)
      .build();
    return new JsonToolCallback(definition, handler);
  }

  @Override
  public ToolDefinition getToolDefinition() {
    return definition;
  }

  @Override
  public String call(String toolInput) {
    JsonNode args = toolInput == null || toolInput.isBlank()
      ? JsonUtils.objectMapper().createObjectNode()
      : JsonUtils.readTree(toolInput);
    try {
      return handler.handle(args);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new ToolExecutionException(definition, e);
    }
  }

  static String requireText(JsonNode args, String field) {
    String value = JsonUtils.text(args, field, null);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required argument '" + field + "'");
    }
    return value;
  }

  static String truncate(String text, int limit) {
    if (text.length() <= limit) {
      return text;
    }
    return text.substring(0, limit) + "\n... [truncated, " + text.length()
      + " characters total]";
  }
}
