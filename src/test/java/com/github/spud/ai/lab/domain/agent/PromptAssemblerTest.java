package com.github.spud.ai.lab.domain.agent;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.ai.lab.application.config.LabToolProperties;
import com.github.spud.ai.lab.domain.message.Transcript;
import com.github.spud.ai.lab.domain.message.Turn;
import com.github.spud.ai.lab.domain.tools.ToolGateway;
import com.github.spud.ai.lab.domain.tools.ToolRegistry;
import com.github.spud.ai.lab.support.TestRoles;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

class PromptAssemblerTest {

  private PromptAssembler assembler;

  @BeforeEach
  void setUp() {
    ToolGateway gateway = new ToolGateway(new ToolRegistry(), new LabToolProperties());
    assembler = new PromptAssembler(gateway,
      Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void ownTurnsAreAssistantMessagesOthersAreAttributed() {
    Transcript transcript = Transcript.empty()
      .append(Turn.builder().author("lead").content("What split?").build())
      .append(Turn.builder().author("ml_expert").content("80/20.").build());

    List<Message> messages = assembler.assemble(TestRoles.lead(), "- ml_expert: models",
      transcript, "task brief");

    assertThat(messages).hasSize(4);
    assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
    assertThat(messages.get(1)).isInstanceOf(UserMessage.class);
    assertThat(messages.get(1).getText()).isEqualTo("task brief");
    assertThat(messages.get(2)).isInstanceOf(AssistantMessage.class);
    assertThat(messages.get(2).getText()).isEqualTo("What split?");
    assertThat(messages.get(3)).isInstanceOf(UserMessage.class);
    assertThat(messages.get(3).getText()).isEqualTo("[ml_expert] 80/20.");
  }

  @Test
  void systemPromptDescribesRoleToolsAndTokens() {
    RoleConfig lead = RoleConfig.builder()
      .id("principal_scientist")
      .name("Principal Scientist")
      .description("leads the planning discussion")
      .prompt("Keep the team focused on the goal.")
      .stopToken("TERMINATE")
      .finalToken("ENTIRE_TASK_DONE")
      .build();

    String prompt = assembler.systemPrompt(lead, "- ml_expert: models");

    assertThat(prompt)
      .startsWith("Today's date is 2025-03-01.")
      .contains("You are Principal Scientist (leads the planning discussion).")
      .contains("Keep the team focused on the goal.")
      .contains("## Team roster\n- ml_expert: models")
      .contains("You have no tools")
      .contains("## Response protocol")
      .contains("Include TERMINATE in your final answer")
      .contains("Include ENTIRE_TASK_DONE only when the entire project is complete");
  }

  @Test
  void criticPromptListsBothVerdicts() {
    String prompt = assembler.systemPrompt(TestRoles.critic(), null);

    assertThat(prompt)
      .doesNotContain("## Team roster")
      .contains("APPROVE_ENGINEER to accept the work, REVISE_ENGINEER to request changes");
  }

  @Test
  void engineerPromptRequiresCompletionToken() {
    String prompt = assembler.systemPrompt(TestRoles.engineer(), "");

    assertThat(prompt).contains("end your final answer with ENGINEER_DONE");
  }
}
