package com.github.spud.ai.lab.domain.agent;

import com.github.spud.ai.lab.domain.message.Transcript;
import com.github.spud.ai.lab.domain.message.Turn;
import com.github.spud.ai.lab.domain.tools.ToolGateway;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;

/**
 * Builds the message list for one model call.
 * <pre>
 * system    : date, role prompt, roster, tool catalog, ReAct protocol, token rules
 * user      : task context
 * assistant : this role's earlier turns
 * user      : "[author] content" for everyone else's turns
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class PromptAssembler {

  static final String REACT_PROTOCOL = """
    ## Response protocol
    Reply with exactly one JSON object and nothing else:
    {"thought": "<short reasoning>", "action": {...}}
    The action is one of:
      a) call a tool:       {"type":"tool","name":"<tool name>","args":{...}}
      b) finish your turn:  {"type":"final","answer":"<your message to the team>"}
      c) no action:         {"type":"none"}
    - One action per reply. Tool results come back as an observation JSON.
    - Your final answer is the only text the other participants will see.
    """;

  private final ToolGateway toolGateway;
  private final Clock clock;

  public List<Message> assemble(RoleConfig role, String roster, Transcript transcript,
    String taskContext) {
    List<Message> messages = new ArrayList<>();
    messages.add(new SystemMessage(systemPrompt(role, roster)));
    messages.add(new UserMessage(taskContext == null ? "" : taskContext));
    for (Turn turn : transcript.turns()) {
      String content = turn.getContent() == null ? "" : turn.getContent();
      if (role.getId().equals(turn.getAuthor())) {
        messages.add(new AssistantMessage(content));
      } else {
        messages.add(new UserMessage("[" + turn.getAuthor() + "] " + content));
      }
    }
    return messages;
  }

  String systemPrompt(RoleConfig role, String roster) {
    StringBuilder sb = new StringBuilder();
    sb.append("Today's date is ").append(LocalDate.now(clock)).append(".\n\n");
    sb.append("You are ").append(role.getName());
    if (role.getDescription() != null && !role.getDescription().isBlank()) {
      sb.append(" (").append(role.getDescription().strip()).append(')');
    }
    sb.append(".\n\n");
    if (role.getPrompt() != null && !role.getPrompt().isBlank()) {
      sb.append(role.getPrompt().strip()).append("\n\n");
    }
    if (roster != null && !roster.isBlank()) {
      sb.append("## Team roster\n").append(roster.strip()).append("\n\n");
    }
    sb.append(toolGateway.buildToolCatalogPrompt(role.getTools())).append('\n');
    sb.append(REACT_PROTOCOL);
    String tokenRules = tokenRules(role);
    if (!tokenRules.isEmpty()) {
      sb.append('\n').append(tokenRules);
    }
    return sb.toString();
  }

  private String tokenRules(RoleConfig role) {
    StringBuilder sb = new StringBuilder();
    if (role.getKind() == AgentKind.ENGINEER && !role.getStopTokens().isEmpty()) {
      sb.append("- Only when every assigned task is finished, end your final answer with ")
        .append(String.join(" or ", role.getStopTokens())).append(".\n");
    } else if (!role.getStopTokens().isEmpty()) {
      sb.append("- Include ").append(String.join(" or ", role.getStopTokens()))
        .append(" in your final answer when the discussion has reached a conclusion.\n");
    }
    if (!role.getFinalTokens().isEmpty()) {
      sb.append("- Include ").append(String.join(" or ", role.getFinalTokens()))
        .append(" only when the entire project is complete.\n");
    }
    if (!role.getApproveTokens().isEmpty() || !role.getReviseTokens().isEmpty()) {
      sb.append("- End your final answer with exactly one verdict: ")
        .append(String.join(" or ", role.getApproveTokens()))
        .append(" to accept the work, ")
        .append(String.join(" or ", role.getReviseTokens()))
        .append(" to request changes.\n");
    }
    if (sb.length() == 0) {
      return "";
    }
    return "## Protocol tokens\n" + sb;
  }
}
