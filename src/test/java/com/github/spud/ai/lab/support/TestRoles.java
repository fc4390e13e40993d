package com.github.spud.ai.lab.support;

import com.github.spud.ai.lab.domain.agent.AgentKind;
import com.github.spud.ai.lab.domain.agent.RoleConfig;

public final class TestRoles {

  private TestRoles() {
  }

  public static RoleConfig lead() {
    return RoleConfig.builder()
      .id("lead")
      .name("Lead")
      .stopToken("TERMINATE")
      .finalToken("ENTIRE_TASK_DONE")
      .build();
  }

  public static RoleConfig expert(String id) {
    return RoleConfig.builder()
      .id(id)
      .name(id)
      .build();
  }

  public static RoleConfig engineer() {
    return RoleConfig.builder()
      .id("engineer")
      .name("Engineer")
      .kind(AgentKind.ENGINEER)
      .stopToken("ENGINEER_DONE")
      .tool("echo")
      .maxToolSteps(5)
      .build();
  }

  public static RoleConfig critic() {
    return RoleConfig.builder()
      .id("critic")
      .name("Critic")
      .stopToken("TERMINATE_CRITIC")
      .approveToken("APPROVE_ENGINEER")
      .reviseToken("REVISE_ENGINEER")
      .build();
  }
}
