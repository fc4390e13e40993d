package com.github.spud.ai.lab.domain.agent;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.ai.lab.domain.message.ToolInvocation;
import com.github.spud.ai.lab.domain.message.Transcript;
import com.github.spud.ai.lab.domain.message.Turn;
import com.github.spud.ai.lab.domain.protocol.VerdictExtractor;
import com.github.spud.ai.lab.domain.protocol.react.ReactJsonAction;
import com.github.spud.ai.lab.domain.protocol.react.ReactJsonParseException;
import com.github.spud.ai.lab.domain.protocol.react.ReactJsonParser;
import com.github.spud.ai.lab.domain.protocol.react.ReactJsonStep;
import com.github.spud.ai.lab.domain.tools.ToolGateway;
import com.github.spud.ai.lab.util.JsonUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * One turn as a bounded THOUGHT / ACTION / OBSERVATION micro-loop.
 * <p>
 * Each step asks the model for a single ReAct JSON object. Tool actions go through the
 * {@link ToolGateway} and come back as an observation; a final action ends the turn once
 * {@link #validateFinalAnswer} accepts it; {@code none} and unparseable output get a correction
 * prompt. Every variant consumes one step. All loop state is local to {@link #takeTurn}.
 */
@Slf4j
@Getter
@SuperBuilder
public abstract class ReActTurnAgent implements Agent {

  static final String PARSE_ERROR_PROMPT = """
    [parse error] Your previous reply could not be parsed as ReAct JSON: %s
    Reply again with only the JSON object:
    {"thought": "...", "action": {"type": "tool|final|none", ...}}""";

  static final String NONE_PROMPT = """
    [hint] You chose action.type=none but you must act. Either call a tool with
    {"type":"tool","name":"...","args":{...}} or finish with {"type":"final","answer":"..."}""";

  protected final RoleConfig role;

  protected final ChatClient chatClient;

  protected final ToolGateway toolGateway;

  protected final ReactJsonParser reactJsonParser;

  protected final PromptAssembler promptAssembler;

  protected final VerdictExtractor verdictExtractor;

  /**
   * Names and duties of the other participants, rendered into the system prompt
   */
  protected final String roster;

  @Builder.Default
  protected final Duration generationTimeout = Duration.ofMinutes(3);

  @Override
  public Turn takeTurn(Transcript transcript, String taskContext) {
    List<Message> messages = promptAssembler.assemble(role, roster, transcript, taskContext);
    List<ToolInvocation> toolCalls = new ArrayList<>();
    String lastThought = null;
    int maxSteps = Math.max(1, role.getMaxToolSteps());

    log.info("[{}] taking turn (transcript size={}, step budget={})", role.getId(),
      transcript.size(), maxSteps);

    for (int step = 1; step <= maxSteps; step++) {
      String modelText = generate(messages);
      messages.add(new AssistantMessage(modelText == null ? "" : modelText));
      log.debug("[{}] step {} model text: {}", role.getId(), step, truncate(modelText, 300));

      ReactJsonStep parsed;
      try {
        parsed = reactJsonParser.parse(modelText);
      } catch (ReactJsonParseException e) {
        log.warn("[{}] step {} unparseable output: {}", role.getId(), step, e.getReason());
        messages.add(new SystemMessage(String.format(PARSE_ERROR_PROMPT, e.getReason())));
        continue;
      }

      if (parsed.getThought() != null && !parsed.getThought().isBlank()) {
        lastThought = parsed.getThought();
      }
      ReactJsonAction action = parsed.getAction();

      switch (action.normalizedType()) {
        case ReactJsonAction.TOOL:
          ToolInvocation invocation = toolGateway.invoke(action.getName(),
            JsonUtils.toJson(action.getArgs()), role.getTools());
          toolCalls.add(invocation);
          messages.add(new SystemMessage(observationJson(invocation)));
          break;

        case ReactJsonAction.FINAL:
          String rejection = validateFinalAnswer(action.getAnswer());
          if (rejection == null) {
            log.info("[{}] turn finished after {} step(s), {} tool call(s)", role.getId(), step,
              toolCalls.size());
            return buildTurn(action.getAnswer(), toolCalls);
          }
          log.debug("[{}] final answer rejected: {}", role.getId(), rejection);
          messages.add(new SystemMessage(rejection));
          break;

        default:
          messages.add(new SystemMessage(NONE_PROMPT));
          break;
      }
    }

    log.warn("[{}] step budget of {} exhausted without a final answer", role.getId(), maxSteps);
    return buildTurn(budgetExhaustedContent(lastThought, maxSteps), toolCalls);
  }

  /**
   * Returns null to accept the answer, or a correction prompt to send back to the model.
   */
  protected abstract String validateFinalAnswer(String answer);

  /**
   * Turn content when the step budget ran out. Protocol tokens are removed so that an unfinished
   * turn can never be read as a completed one.
   */
  protected String budgetExhaustedContent(String lastThought, int maxSteps) {
    String thought = verdictExtractor.strip(lastThought, role.allTokens());
    String note = "[step budget of " + maxSteps + " exhausted before a final answer]";
    return thought.isEmpty() ? note : thought + "\n\n" + note;
  }

  protected String generate(List<Message> messages) {
    Prompt prompt = new Prompt(List.copyOf(messages));
    ChatResponse response;
    try {
      response = Mono.fromCallable(() -> chatClient.prompt(prompt).call().chatResponse())
        .subscribeOn(Schedulers.boundedElastic())
        .timeout(generationTimeout)
        .block();
    } catch (Exception e) {
      Throwable cause = Exceptions.unwrap(e);
      if (cause instanceof TimeoutException) {
        throw new FatalAgentException("Model call for role '" + role.getId()
          + "' timed out after " + generationTimeout.toMillis() + "ms", cause);
      }
      throw new FatalAgentException("Model call for role '" + role.getId() + "' failed: "
        + cause.getMessage(), cause);
    }
    if (response == null || response.getResult() == null
      || response.getResult().getOutput() == null) {
      throw new FatalAgentException("Model returned no output for role '" + role.getId() + "'");
    }
    return response.getResult().getOutput().getText();
  }

  private Turn buildTurn(String content, List<ToolInvocation> toolCalls) {
    return Turn.builder()
      .author(role.getId())
      .content(content)
      .toolCalls(toolCalls)
      .build();
  }

  static String observationJson(ToolInvocation invocation) {
    ObjectNode obsNode = JsonUtils.objectMapper().createObjectNode();
    ObjectNode dataNode = obsNode.putObject("observation");
    dataNode.put("tool", invocation.getToolName());
    dataNode.put("ok", invocation.isSuccess());
    if (invocation.isSuccess()) {
      dataNode.put("result", invocation.getResult());
    } else {
      dataNode.put("error", invocation.getError());
    }
    return JsonUtils.toJson(obsNode);
  }

  static String truncate(String text, int maxLen) {
    if (text == null) {
      return null;
    }
    return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
  }
}
