package com.github.spud.ai.lab.domain.agent;

import java.util.List;
import java.util.stream.Stream;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable description of one agent role. Prompt wording is data; only the token sets and the
 * tool capability set are interpreted by the engine.
 */
@Value
@Builder
public class RoleConfig {

  String id;

  String name;

  String description;

  @Builder.Default
  AgentKind kind = AgentKind.DISCUSSION;

  String prompt;

  /**
   * Capability set: the only tools this role may invoke.
   */
  @Singular
  List<String> tools;

  /**
   * Ends the role's turn or, for a closer, hands off to the next team.
   */
  @Singular
  List<String> stopTokens;

  /**
   * Declares the whole project done. Only meaningful for a planning closer.
   */
  @Singular
  List<String> finalTokens;

  @Singular
  List<String> approveTokens;

  @Singular
  List<String> reviseTokens;

  @Builder.Default
  int maxToolSteps = 8;

  /**
   * Every protocol token this role may emit.
   */
  public List<String> allTokens() {
    return Stream.of(finalTokens, stopTokens, approveTokens, reviseTokens)
      .flatMap(List::stream)
      .toList();
  }
}
