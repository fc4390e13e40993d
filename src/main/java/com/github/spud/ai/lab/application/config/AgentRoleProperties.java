package com.github.spud.ai.lab.application.config;

import com.github.spud.ai.lab.domain.agent.AgentKind;
import com.github.spud.ai.lab.domain.agent.RoleConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Role definitions keyed by role id, bound from {@code lab.agents.roles}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "lab.agents")
public class AgentRoleProperties {

  private Map<String, RoleDefinition> roles = new LinkedHashMap<>();

  @Data
  public static class RoleDefinition {

    /**
     * Display name; the role id when blank
     */
    private String name;

    private String description = "";

    private AgentKind kind = AgentKind.DISCUSSION;

    private String prompt = "";

    private List<String> tools = new ArrayList<>();

    private List<String> stopTokens = new ArrayList<>();

    private List<String> finalTokens = new ArrayList<>();

    private List<String> approveTokens = new ArrayList<>();

    private List<String> reviseTokens = new ArrayList<>();

    private int maxToolSteps = 8;

    public RoleConfig toRoleConfig(String id) {
      return RoleConfig.builder()
        .id(id)
        .name(name == null || name.isBlank() ? id : name)
        .description(description)
        .kind(kind)
        .prompt(prompt)
        .tools(tools)
        .stopTokens(stopTokens)
        .finalTokens(finalTokens)
        .approveTokens(approveTokens)
        .reviseTokens(reviseTokens)
        .maxToolSteps(maxToolSteps)
        .build();
    }
  }
}
