package com.github.spud.ai.lab.application.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.ai.lab.domain.agent.AgentKind;
import com.github.spud.ai.lab.domain.agent.RoleConfig;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class LabConfigPropertiesTest {

  @Test
  void briefRendersIndentedBlocksAndData() {
    LabTaskProperties task = new LabTaskProperties();
    task.setName("basic_epigenetic_clock");
    task.setGoal("Predict age from methylation.\nReport MAE.");
    LabTaskProperties.DataFile betas = new LabTaskProperties.DataFile();
    betas.setName("betas.arrow");
    betas.setDescription("beta values, samples x CpG sites");
    task.setAvailableData(List.of(betas));

    String brief = task.toBrief();

    assertThat(brief).isEqualTo("""
      name: basic_epigenetic_clock
      goal:
        Predict age from methylation.
        Report MAE.
      available_data:
        - betas.arrow: beta values, samples x CpG sites""");
  }

  @Test
  void planningOrderIsLeadThenExperts() {
    LabTeamProperties teams = new LabTeamProperties();
    teams.setPlanningLead("lead");
    teams.setPlanningExperts(List.of("a", "b"));

    assertThat(teams.planningOrder()).containsExactly("lead", "a", "b");
  }

  @Test
  void roleDefinitionDefaultsNameToId() {
    AgentRoleProperties.RoleDefinition definition = new AgentRoleProperties.RoleDefinition();
    definition.setKind(AgentKind.ENGINEER);
    definition.setStopTokens(List.of("ENGINEER_DONE"));
    definition.setTools(List.of("execute_code"));
    definition.setMaxToolSteps(20);

    RoleConfig role = definition.toRoleConfig("implementation_engineer");

    assertThat(role.getName()).isEqualTo("implementation_engineer");
    assertThat(role.getKind()).isEqualTo(AgentKind.ENGINEER);
    assertThat(role.getTools()).containsExactly("execute_code");
    assertThat(role.getMaxToolSteps()).isEqualTo(20);
    assertThat(role.allTokens()).containsExactly("ENGINEER_DONE");
  }

  @Test
  void codeTimeoutMustBeShorterThanToolTimeout() {
    LabToolProperties tools = new LabToolProperties();
    try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
      Validator validator = factory.getValidator();
      assertThat(validator.validate(tools)).isEmpty();

      tools.setTimeout(Duration.ofMinutes(1));
      tools.setCodeTimeout(Duration.ofMinutes(5));
      Set<ConstraintViolation<LabToolProperties>> violations = validator.validate(tools);

      assertThat(violations).singleElement()
        .extracting(ConstraintViolation::getMessage)
        .isEqualTo("lab.tools.code-timeout must be shorter than lab.tools.timeout");
    }
  }
}
