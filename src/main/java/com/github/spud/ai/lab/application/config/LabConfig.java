package com.github.spud.ai.lab.application.config;

import com.github.spud.ai.lab.domain.agent.AgentRegistry;
import com.github.spud.ai.lab.domain.chat.RoundRobinSubChat;
import com.github.spud.ai.lab.domain.notebook.NotebookStore;
import com.github.spud.ai.lab.domain.orchestrator.LabOrchestrator;
import com.github.spud.ai.lab.domain.orchestrator.PlanningPromptFormatter;
import com.github.spud.ai.lab.domain.protocol.VerdictExtractor;
import com.github.spud.ai.lab.domain.revision.RevisionLoop;
import com.github.spud.ai.lab.domain.revision.StateMachineDriver;
import com.github.spud.ai.lab.infrastructure.notebook.InMemoryNotebookStore;
import com.github.spud.ai.lab.infrastructure.notebook.JsonLinesNotebookStore;
import java.nio.file.Path;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Wires the two teams, the notebook and the orchestrator from {@code lab.*} properties.
 */
@Slf4j
@Configuration
public class LabConfig {

  @Bean
  public ChatClient chatClient(ChatModel chatModel) {
    return ChatClient.builder(chatModel).build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public NotebookStore notebookStore(LabRunProperties runProperties, Clock clock) {
    if (runProperties.isInMemoryNotebook()) {
      log.warn("Using in-memory lab notebook; entries will not survive a restart");
      return new InMemoryNotebookStore(clock);
    }
    return new JsonLinesNotebookStore(Path.of(runProperties.getNotebookPath()), clock);
  }

  @Bean
  @Lazy
  public RoundRobinSubChat planningChat(AgentRegistry agentRegistry,
    VerdictExtractor verdictExtractor, LabTeamProperties teamProperties,
    LabRunProperties runProperties) {
    return RoundRobinSubChat.builder()
      .name("planning")
      .participants(agentRegistry.getAgents(teamProperties.planningOrder()))
      .closer(agentRegistry.getAgent(teamProperties.getPlanningLead()))
      .maxTurns(runProperties.getPlanningMaxTurns())
      .verdictExtractor(verdictExtractor)
      .build();
  }

  @Bean
  @Lazy
  public RevisionLoop revisionLoop(AgentRegistry agentRegistry, VerdictExtractor verdictExtractor,
    StateMachineDriver stateMachineDriver, LabTeamProperties teamProperties,
    LabRunProperties runProperties) {
    return RevisionLoop.builder()
      .engineer(agentRegistry.getAgent(teamProperties.getEngineer()))
      .critic(agentRegistry.getAgent(teamProperties.getCritic()))
      .maxRevisions(runProperties.getMaxRevisions())
      .reportMessageLimit(runProperties.getReportMessageLimit())
      .outputDir(runProperties.getOutputDir())
      .verdictExtractor(verdictExtractor)
      .stateMachineDriver(stateMachineDriver)
      .build();
  }

  @Bean
  @Lazy
  public LabOrchestrator labOrchestrator(RoundRobinSubChat planningChat, RevisionLoop revisionLoop,
    NotebookStore notebookStore, LabRunProperties runProperties,
    LabTaskProperties taskProperties) {
    return LabOrchestrator.builder()
      .planningChat(planningChat)
      .revisionLoop(revisionLoop)
      .notebookStore(notebookStore)
      .promptFormatter(new PlanningPromptFormatter(taskProperties.toBrief()))
      .maxOuterIterations(runProperties.getMaxOuterIterations())
      .notebookCharLimit(runProperties.getNotebookCharLimit())
      .persistTransitions(runProperties.isPersistTransitions())
      .build();
  }
}
