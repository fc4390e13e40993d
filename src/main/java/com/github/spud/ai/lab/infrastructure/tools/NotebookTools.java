package com.github.spud.ai.lab.infrastructure.tools;

import static com.github.spud.ai.lab.infrastructure.tools.JsonToolCallback.requireText;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.ai.lab.application.config.LabRunProperties;
import com.github.spud.ai.lab.application.config.LabTeamProperties;
import com.github.spud.ai.lab.domain.notebook.AuthorTeam;
import com.github.spud.ai.lab.domain.notebook.EntryType;
import com.github.spud.ai.lab.domain.notebook.NotebookEntry;
import com.github.spud.ai.lab.domain.notebook.NotebookFormatter;
import com.github.spud.ai.lab.domain.notebook.NotebookStore;
import com.github.spud.ai.lab.domain.tools.ToolRegistry;
import jakarta.annotation.PostConstruct;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * read_notebook and write_notebook over the shared {@link NotebookStore}.
 * <p>
 * Agents may not write COMPLETION entries; completion is recorded by the orchestrator alone.
 */
@Component
@RequiredArgsConstructor
public class NotebookTools {

  private final ToolRegistry toolRegistry;
  private final NotebookStore notebookStore;
  private final LabRunProperties runProperties;
  private final LabTeamProperties teamProperties;

  @PostConstruct
  public void register() {
    toolRegistry.register(JsonToolCallback.of("read_notebook",
      "Read the lab notebook: plans, notes and outputs of both teams, newest last.",
      """
        {
            "type": "object",
            "properties": {}
        }
        """,
      args -> NotebookFormatter.render(notebookStore.read(), runProperties.getNotebookCharLimit())));

    toolRegistry.register(JsonToolCallback.of("write_notebook",
      "Append an entry to the lab notebook. Entries can never be edited; to correct one, write "
        + "a new entry with supersedes set to its number.",
      """
        {
            "type": "object",
            "properties": {
                "entry": {"type": "string", "description": "Markdown body of the entry"},
                "entry_type": {"type": "string", "enum": ["PLAN", "NOTE", "OUTPUT"]},
                "source": {"type": "string", "description": "Your role id"},
                "supersedes": {"type": "integer", "description": "Number of the entry this one corrects"}
            },
            "required": ["entry", "entry_type", "source"]
        }
        """,
      this::writeNotebook));
  }

  String writeNotebook(JsonNode args) {
    String body = requireText(args, "entry");
    String source = requireText(args, "source");
    EntryType type = parseType(requireText(args, "entry_type"));
    Long supersedes = args.hasNonNull("supersedes") ? args.get("supersedes").asLong() : null;

    NotebookEntry stored = notebookStore.append(NotebookEntry.builder()
      .team(teamOf(source))
      .source(source)
      .type(type)
      .body(body)
      .supersedes(supersedes)
      .build());
    return "Notebook entry #" + stored.getSequence() + " (" + type + ") recorded.";
  }

  private EntryType parseType(String raw) {
    EntryType type;
    try {
      type = EntryType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown entry_type '" + raw + "', expected PLAN, NOTE or OUTPUT");
    }
    if (type == EntryType.COMPLETION) {
      throw new IllegalArgumentException("COMPLETION entries are reserved for the orchestrator");
    }
    return type;
  }

  private AuthorTeam teamOf(String source) {
    return teamProperties.planningOrder().contains(source)
      ? AuthorTeam.PLANNING : AuthorTeam.IMPLEMENTATION;
  }
}
