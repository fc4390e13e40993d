package com.github.spud.ai.lab.domain.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.ai.lab.application.config.LabToolProperties;
import com.github.spud.ai.lab.domain.message.ToolInvocation;
import com.github.spud.ai.lab.domain.message.Transcript;
import com.github.spud.ai.lab.domain.message.Turn;
import com.github.spud.ai.lab.domain.protocol.VerdictExtractor;
import com.github.spud.ai.lab.domain.protocol.react.ReactJsonParser;
import com.github.spud.ai.lab.domain.tools.ToolGateway;
import com.github.spud.ai.lab.domain.tools.ToolRegistry;
import com.github.spud.ai.lab.support.TestRoles;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;

@ExtendWith(MockitoExtension.class)
class EngineerAgentTest {

  @Mock
  private ChatClient chatClient;

  @Mock
  private ChatClient.ChatClientRequestSpec requestSpec;

  @Mock
  private ChatClient.CallResponseSpec callResponseSpec;

  private ToolGateway toolGateway;

  @BeforeEach
  void setUp() {
    ToolRegistry registry = new ToolRegistry();
    ToolDefinition echo = DefaultToolDefinition.builder()
      .name("echo")
      .description("Echo the input")
      .inputSchema("{\"type\":\"object\",\"properties\":{\"text\":{\"type\":\"string\"}}}")
      .build();
    registry.register(new ToolCallback() {
      @Override
      public ToolDefinition getToolDefinition() {
        return echo;
      }

      @Override
      public String call(String toolInput) {
        return "echoed " + toolInput;
      }
    });
    toolGateway = new ToolGateway(registry, new LabToolProperties());
  }

  private EngineerAgent agent(RoleConfig role, Duration generationTimeout) {
    return EngineerAgent.builder()
      .role(role)
      .chatClient(chatClient)
      .toolGateway(toolGateway)
      .reactJsonParser(new ReactJsonParser())
      .promptAssembler(new PromptAssembler(toolGateway, Clock.systemUTC()))
      .verdictExtractor(new VerdictExtractor())
      .roster("- critic: reviews the work")
      .generationTimeout(generationTimeout)
      .build();
  }

  private EngineerAgent agent() {
    return agent(TestRoles.engineer(), Duration.ofSeconds(10));
  }

  private void stubModelCalls() {
    when(chatClient.prompt(any(Prompt.class))).thenReturn(requestSpec);
    when(requestSpec.call()).thenReturn(callResponseSpec);
  }

  private static ChatResponse response(String text) {
    return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
  }

  @Test
  void toolStepThenAcceptedFinalAnswer() {
    stubModelCalls();
    when(callResponseSpec.chatResponse()).thenReturn(
      response("{\"thought\":\"check\",\"action\":{\"type\":\"tool\",\"name\":\"echo\",\"args\":{\"text\":\"hi\"}}}"),
      response("{\"thought\":\"done\",\"action\":{\"type\":\"final\",\"answer\":\"Trained the model.\"}}"),
      response("{\"thought\":\"done\",\"action\":{\"type\":\"final\",\"answer\":\"Trained the model. ENGINEER_DONE\"}}"));

    Turn turn = agent().takeTurn(Transcript.empty(), "Train a baseline.");

    assertThat(turn.getAuthor()).isEqualTo("engineer");
    assertThat(turn.getContent()).isEqualTo("Trained the model. ENGINEER_DONE");
    assertThat(turn.getToolCalls()).singleElement()
      .satisfies(call -> {
        assertThat(call.isSuccess()).isTrue();
        assertThat(call.getResult()).isEqualTo("echoed {\"text\":\"hi\"}");
      });

    ArgumentCaptor<Prompt> prompts = ArgumentCaptor.forClass(Prompt.class);
    verify(chatClient, times(3)).prompt(prompts.capture());
    List<Message> lastPrompt = prompts.getAllValues().get(2).getInstructions();
    assertThat(lastPrompt).filteredOn(m -> m instanceof SystemMessage)
      .extracting(Message::getText)
      .anySatisfy(text -> assertThat(text)
        .isEqualTo("{\"observation\":{\"tool\":\"echo\",\"ok\":true,\"result\":\"echoed {\\\"text\\\":\\\"hi\\\"}\"}}"))
      .anySatisfy(text -> assertThat(text).contains("does not contain ENGINEER_DONE"));
  }

  @Test
  void unparseableOutputGetsCorrectionPrompt() {
    stubModelCalls();
    when(callResponseSpec.chatResponse()).thenReturn(
      response("I will now write the script."),
      response("{\"thought\":\"ok\",\"action\":{\"type\":\"final\",\"answer\":\"Done ENGINEER_DONE\"}}"));

    Turn turn = agent().takeTurn(Transcript.empty(), "task");

    assertThat(turn.getContent()).isEqualTo("Done ENGINEER_DONE");
    ArgumentCaptor<Prompt> prompts = ArgumentCaptor.forClass(Prompt.class);
    verify(chatClient, times(2)).prompt(prompts.capture());
    assertThat(prompts.getAllValues().get(1).getInstructions())
      .extracting(Message::getText)
      .anySatisfy(text -> assertThat(text).startsWith("[parse error]"));
  }

  @Test
  void budgetExhaustionNeverCarriesCompletionToken() {
    stubModelCalls();
    when(callResponseSpec.chatResponse()).thenReturn(
      response("{\"thought\":\"Almost there, ENGINEER_DONE soon\",\"action\":{\"type\":\"none\"}}"));
    RoleConfig role = RoleConfig.builder()
      .id("engineer")
      .name("Engineer")
      .kind(AgentKind.ENGINEER)
      .stopToken("ENGINEER_DONE")
      .maxToolSteps(2)
      .build();

    Turn turn = agent(role, Duration.ofSeconds(10)).takeTurn(Transcript.empty(), "task");

    assertThat(turn.getContent())
      .startsWith("Almost there,")
      .endsWith("[step budget of 2 exhausted before a final answer]")
      .doesNotContain("ENGINEER_DONE");
    verify(chatClient, times(2)).prompt(any(Prompt.class));
  }

  @Test
  void toolOutsideCapabilitySetIsObservedAsError() {
    stubModelCalls();
    when(callResponseSpec.chatResponse()).thenReturn(
      response("{\"thought\":\"search\",\"action\":{\"type\":\"tool\",\"name\":\"search\",\"args\":{\"query\":\"horvath\"}}}"),
      response("{\"thought\":\"ok\",\"action\":{\"type\":\"final\",\"answer\":\"No search. ENGINEER_DONE\"}}"));

    Turn turn = agent().takeTurn(Transcript.empty(), "task");

    assertThat(turn.failedToolCalls()).extracting(ToolInvocation::getError)
      .containsExactly("Tool 'search' is not permitted for this role");
  }

  @Test
  void modelFailureIsFatal() {
    stubModelCalls();
    when(callResponseSpec.chatResponse()).thenThrow(new IllegalStateException("503 from provider"));

    assertThatThrownBy(() -> agent().takeTurn(Transcript.empty(), "task"))
      .isInstanceOf(FatalAgentException.class)
      .hasMessageContaining("503 from provider");
  }

  @Test
  void slowModelTimesOut() {
    stubModelCalls();
    when(callResponseSpec.chatResponse()).thenAnswer(invocation -> {
      Thread.sleep(3_000);
      return response("{\"thought\":\"late\",\"action\":{\"type\":\"none\"}}");
    });

    assertThatThrownBy(() -> agent(TestRoles.engineer(), Duration.ofMillis(100))
      .takeTurn(Transcript.empty(), "task"))
      .isInstanceOf(FatalAgentException.class)
      .hasMessageContaining("timed out");
  }

  @Test
  void discussionAgentAcceptsAnyFinalAnswer() {
    stubModelCalls();
    when(callResponseSpec.chatResponse()).thenReturn(
      response("{\"thought\":\"x\",\"action\":{\"type\":\"final\",\"answer\":\"Use ElasticNet.\"}}"));
    DiscussionAgent expert = DiscussionAgent.builder()
      .role(TestRoles.expert("ml_expert"))
      .chatClient(chatClient)
      .toolGateway(toolGateway)
      .reactJsonParser(new ReactJsonParser())
      .promptAssembler(new PromptAssembler(toolGateway, Clock.systemUTC()))
      .verdictExtractor(new VerdictExtractor())
      .build();

    Turn turn = expert.takeTurn(Transcript.empty(), "task");

    assertThat(turn.getContent()).isEqualTo("Use ElasticNet.");
    assertThat(turn.getToolCalls()).isEmpty();
    assertThat(expert.getGenerationTimeout()).isEqualTo(Duration.ofMinutes(3));
  }

  @Test
  void blankFinalAnswerIsCorrectedBeforeTheTurnEnds() {
    stubModelCalls();
    when(callResponseSpec.chatResponse()).thenReturn(
      response("{\"thought\":\"x\",\"action\":{\"type\":\"final\",\"answer\":\"   \"}}"),
      response("{\"thought\":\"x\",\"action\":{\"type\":\"final\",\"answer\":\"Use ElasticNet.\"}}"));
    DiscussionAgent expert = DiscussionAgent.builder()
      .role(TestRoles.expert("ml_expert"))
      .chatClient(chatClient)
      .toolGateway(toolGateway)
      .reactJsonParser(new ReactJsonParser())
      .promptAssembler(new PromptAssembler(toolGateway, Clock.systemUTC()))
      .verdictExtractor(new VerdictExtractor())
      .build();

    Turn turn = expert.takeTurn(Transcript.empty(), "task");

    assertThat(turn.getContent()).isEqualTo("Use ElasticNet.");
    ArgumentCaptor<Prompt> prompts = ArgumentCaptor.forClass(Prompt.class);
    verify(chatClient, times(2)).prompt(prompts.capture());
    assertThat(prompts.getAllValues().get(1).getInstructions())
      .filteredOn(m -> m instanceof SystemMessage)
      .extracting(Message::getText)
      .anySatisfy(text -> assertThat(text).contains("Answer is required"));
  }
}
