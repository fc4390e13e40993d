package com.github.spud.ai.lab.domain.notebook;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One immutable notebook record.
 * <p>
 * {@code sequence} and {@code timestamp} are assigned by the store on append; values supplied by
 * the caller are ignored. {@code supersedes} optionally points at an earlier entry this one
 * corrects.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class NotebookEntry {

  long sequence;
  Instant timestamp;
  AuthorTeam team;
  String source;
  EntryType type;
  String body;
  Long supersedes;

  public static NotebookEntry of(AuthorTeam team, String source, EntryType type, String body) {
    return NotebookEntry.builder()
      .team(team)
      .source(source)
      .type(type)
      .body(body)
      .build();
  }
}
