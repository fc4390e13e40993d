package com.github.spud.ai.lab.domain.agent;

import com.github.spud.ai.lab.application.config.AgentRoleProperties;
import com.github.spud.ai.lab.application.config.LabRunProperties;
import com.github.spud.ai.lab.domain.protocol.VerdictExtractor;
import com.github.spud.ai.lab.domain.protocol.react.ReactJsonParser;
import com.github.spud.ai.lab.domain.tools.ToolGateway;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

/**
 * Resolves role ids to configured agents. Agents are built once per role and reused; they hold no
 * per-turn state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentRegistry {

  private final AgentRoleProperties roleProperties;
  private final LabRunProperties runProperties;
  private final ChatClient chatClient;
  private final ToolGateway toolGateway;
  private final ReactJsonParser reactJsonParser;
  private final PromptAssembler promptAssembler;
  private final VerdictExtractor verdictExtractor;

  private final Map<String, Agent> agents = new ConcurrentHashMap<>();

  /**
   * @throws IllegalArgumentException when no role with this id is configured
   */
  public RoleConfig getRole(String roleId) {
    AgentRoleProperties.RoleDefinition definition = roleProperties.getRoles().get(roleId);
    if (definition == null) {
      throw new IllegalArgumentException("Unknown agent role: '" + roleId + "'. Configured roles: "
        + roleIds());
    }
    return definition.toRoleConfig(roleId);
  }

  public Agent getAgent(String roleId) {
    return agents.computeIfAbsent(roleId, this::createAgent);
  }

  public List<Agent> getAgents(List<String> roleIds) {
    return roleIds.stream().map(this::getAgent).toList();
  }

  public Set<String> roleIds() {
    return roleProperties.getRoles().keySet();
  }

  private Agent createAgent(String roleId) {
    RoleConfig role = getRole(roleId);
    log.info("Creating {} agent for role {} (tools={})", role.getKind(), roleId, role.getTools());
    switch (role.getKind()) {
      case ENGINEER:
        return EngineerAgent.builder()
          .role(role)
          .chatClient(chatClient)
          .toolGateway(toolGateway)
          .reactJsonParser(reactJsonParser)
          .promptAssembler(promptAssembler)
          .verdictExtractor(verdictExtractor)
          .roster(roster(roleId))
          .generationTimeout(runProperties.getGenerationTimeout())
          .build();
      case DISCUSSION:
      default:
        return DiscussionAgent.builder()
          .role(role)
          .chatClient(chatClient)
          .toolGateway(toolGateway)
          .reactJsonParser(reactJsonParser)
          .promptAssembler(promptAssembler)
          .verdictExtractor(verdictExtractor)
          .roster(roster(roleId))
          .generationTimeout(runProperties.getGenerationTimeout())
          .build();
    }
  }

  private String roster(String self) {
    return roleProperties.getRoles().entrySet().stream()
      .filter(e -> !e.getKey().equals(self))
      .map(e -> "- " + e.getKey() + ": " + e.getValue().getDescription())
      .collect(Collectors.joining("\n"));
  }
}
