package com.github.spud.ai.lab.support;

import com.github.spud.ai.lab.domain.agent.Agent;
import com.github.spud.ai.lab.domain.agent.RoleConfig;
import com.github.spud.ai.lab.domain.message.Transcript;
import com.github.spud.ai.lab.domain.message.Turn;
import java.util.ArrayList;
import java.util.List;

/**
 * Agent that replays canned turns in order and repeats the last one once the script runs out.
 */
public class ScriptedAgent implements Agent {

  private final RoleConfig role;
  private final List<Turn> script;
  private final List<String> contexts = new ArrayList<>();
  private final List<Integer> transcriptSizes = new ArrayList<>();

  private ScriptedAgent(RoleConfig role, List<Turn> script) {
    this.role = role;
    this.script = script;
  }

  public static ScriptedAgent replying(RoleConfig role, String... replies) {
    List<Turn> turns = new ArrayList<>();
    for (String reply : replies) {
      turns.add(Turn.builder().author(role.getId()).content(reply).build());
    }
    return new ScriptedAgent(role, turns);
  }

  public static ScriptedAgent withTurns(RoleConfig role, Turn... turns) {
    return new ScriptedAgent(role, List.of(turns));
  }

  @Override
  public RoleConfig getRole() {
    return role;
  }

  @Override
  public Turn takeTurn(Transcript transcript, String taskContext) {
    contexts.add(taskContext);
    transcriptSizes.add(transcript.size());
    int index = Math.min(contexts.size() - 1, script.size() - 1);
    return script.get(index);
  }

  public int getCalls() {
    return contexts.size();
  }

  public List<String> getContexts() {
    return contexts;
  }

  public List<Integer> getTranscriptSizes() {
    return transcriptSizes;
  }
}
