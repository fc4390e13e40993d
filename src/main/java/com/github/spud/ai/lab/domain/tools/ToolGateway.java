package com.github.spud.ai.lab.domain.tools;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.ai.lab.application.config.LabToolProperties;
import com.github.spud.ai.lab.domain.message.ToolInvocation;
import com.github.spud.ai.lab.domain.notebook.NotebookStoreException;
import com.github.spud.ai.lab.util.JsonUtils;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Uniform entry point for tool calls.
 * <p>
 * Every call returns a {@link ToolInvocation}; unknown tools, tools outside the caller's capability
 * set, exceptions and timeouts become structured errors. The one exception is a
 * {@link NotebookStoreException}: a notebook that cannot be written ends the run, so it is rethrown.
 * The call runs on the bounded-elastic scheduler and the caller blocks for at most
 * {@code lab.tools.timeout}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolGateway {

  private final ToolRegistry toolRegistry;
  private final LabToolProperties toolProperties;

  /**
   * Invokes a tool on behalf of a role restricted to {@code permitted}.
   */
  public ToolInvocation invoke(String toolName, String arguments, Collection<String> permitted) {
    if (permitted != null && !permitted.contains(toolName)) {
      log.warn("Tool {} is outside the caller's capability set {}", toolName, permitted);
      return ToolInvocation.failure(toolName, arguments,
        "Tool '" + toolName + "' is not permitted for this role", 0);
    }
    return invoke(toolName, arguments);
  }

  /**
   * Invokes a tool without a capability check.
   *
   * @throws NotebookStoreException when the tool failed to write the notebook
   */
  public ToolInvocation invoke(String toolName, String arguments) {
    long startTime = System.currentTimeMillis();
    Optional<ToolCallback> callback = toolRegistry.getCallback(toolName);
    if (callback.isEmpty()) {
      log.error("Tool not found: {}", toolName);
      return ToolInvocation.failure(toolName, arguments, "Tool not found: " + toolName, 0);
    }

    String input = arguments == null || arguments.isBlank() ? "{}" : arguments;
    Duration timeout = toolProperties.getTimeout();
    log.debug("Executing tool: {} with args: {}", toolName, truncate(input, 200));

    try {
      String result = Mono.fromCallable(() -> callback.get().call(input))
        .subscribeOn(Schedulers.boundedElastic())
        .timeout(timeout)
        .block();
      long duration = System.currentTimeMillis() - startTime;
      log.debug("Tool {} completed in {}ms", toolName, duration);
      return ToolInvocation.success(toolName, arguments, result, duration);
    } catch (Exception e) {
      long duration = System.currentTimeMillis() - startTime;
      Throwable cause = Exceptions.unwrap(e);
      if (cause instanceof TimeoutException) {
        log.warn("Tool {} timed out after {}ms", toolName, duration);
        return ToolInvocation.timeout(toolName, arguments, timeout.toMillis());
      }
      if (cause instanceof NotebookStoreException storeFailure) {
        log.error("Tool {} could not write the notebook: {}", toolName, storeFailure.getMessage());
        throw storeFailure;
      }
      String message = cause.getMessage() != null ? cause.getMessage()
        : cause.getClass().getSimpleName();
      log.error("Tool execution failed: {} - {}", toolName, message, cause);
      return ToolInvocation.failure(toolName, arguments, message, duration);
    }
  }

  public List<ToolDefinition> permittedDefinitions(Collection<String> permitted) {
    return permitted.stream()
      .map(toolRegistry::getDefinition)
      .flatMap(Optional::stream)
      .toList();
  }

  /**
   * Tool catalog for a role, listing only the tools it may call.
   */
  public String buildToolCatalogPrompt(Collection<String> permitted) {
    List<ToolDefinition> allowed = permittedDefinitions(permitted);
    StringBuilder sb = new StringBuilder();
    sb.append("## Available tools\n");
    if (allowed.isEmpty()) {
      sb.append("You have no tools. Answer with action.type=final.\n");
    } else {
      sb.append("You may call the following tools (JSON array):\n\n");
      sb.append(buildToolsJsonArray(allowed)).append('\n');
    }
    return sb.toString();
  }

  private String buildToolsJsonArray(Collection<ToolDefinition> tools) {
    ArrayNode arrayNode = JsonUtils.objectMapper().createArrayNode();
    for (ToolDefinition def : tools) {
      ObjectNode toolNode = arrayNode.addObject();
      toolNode.put("name", def.name());
      toolNode.put("description", def.description());
      String schema = def.inputSchema();
      if (schema == null || schema.isBlank()) {
        toolNode.putObject("inputSchema");
      } else {
        try {
          toolNode.set("inputSchema", JsonUtils.readTree(schema));
        } catch (IllegalArgumentException e) {
          log.warn("Failed to parse inputSchema for tool {}: {}", def.name(), e.getMessage());
          toolNode.put("inputSchema", schema);
        }
      }
    }
    try {
      return JsonUtils.objectMapper().writerWithDefaultPrettyPrinter()
        .writeValueAsString(arrayNode);
    } catch (Exception e) {
      log.error("Failed to build tools JSON array: {}", e.getMessage(), e);
      return "[]";
    }
  }

  private static String truncate(String text, int maxLen) {
    return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
  }
}
