package com.github.spud.ai.lab.infrastructure.notebook;

import com.github.spud.ai.lab.domain.notebook.NotebookEntry;
import com.github.spud.ai.lab.domain.notebook.NotebookStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Process-local store for tests and dry runs. Nothing survives a restart.
 */
public class InMemoryNotebookStore implements NotebookStore {

  private final List<NotebookEntry> entries = new ArrayList<>();
  private final Clock clock;

  public InMemoryNotebookStore() {
    this(Clock.systemUTC());
  }

  public InMemoryNotebookStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized NotebookEntry append(NotebookEntry entry) {
    NotebookEntry stored = entry.toBuilder()
      .sequence(entries.size() + 1L)
      .timestamp(clock.instant())
      .build();
    entries.add(stored);
    return stored;
  }

  @Override
  public synchronized List<NotebookEntry> read() {
    return List.copyOf(entries);
  }

  @Override
  public synchronized List<NotebookEntry> readSince(long sequence) {
    return entries.stream().filter(e -> e.getSequence() > sequence).toList();
  }
}
