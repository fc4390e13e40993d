package com.github.spud.ai.lab.domain.tools;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

/**
 * Name-keyed registry of every tool the gateway can reach.
 */
@Slf4j
@Component
public class ToolRegistry {

  private final Map<String, ToolCallback> callbackMap = new ConcurrentHashMap<>();

  private final Map<String, ToolDefinition> definitionMap = new ConcurrentHashMap<>();

  public void register(String toolName, ToolDefinition definition, ToolCallback callback) {
    log.info("Registering tool: {}", toolName);
    definitionMap.put(toolName, definition);
    callbackMap.put(toolName, callback);
  }

  /**
   * Registers under the name carried by the callback's own definition.
   */
  public void register(ToolCallback callback) {
    ToolDefinition def = callback.getToolDefinition();
    if (def != null) {
      register(def.name(), def, callback);
    } else {
      log.warn("Cannot register tool without definition: {}", callback);
    }
  }

  public Optional<ToolCallback> getCallback(String toolName) {
    return Optional.ofNullable(callbackMap.get(toolName));
  }

  public Optional<ToolDefinition> getDefinition(String toolName) {
    return Optional.ofNullable(definitionMap.get(toolName));
  }

  public Collection<ToolDefinition> getAllDefinitions() {
    return definitionMap.values();
  }

  public boolean hasToolByName(String toolName) {
    return callbackMap.containsKey(toolName);
  }

  public int size() {
    return callbackMap.size();
  }
}
