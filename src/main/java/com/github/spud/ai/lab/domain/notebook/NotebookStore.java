package com.github.spud.ai.lab.domain.notebook;

import java.util.List;

/**
 * Append-only, durable, ordered notebook shared by both teams.
 * <p>
 * Implementations must keep earlier entries byte-for-byte stable: a later {@link #read()} always
 * starts with every entry a former read returned.
 */
public interface NotebookStore {

  /**
   * Stores a new entry and returns it with its sequence and timestamp assigned.
   *
   * @throws NotebookStoreException when the entry could not be made durable
   */
  NotebookEntry append(NotebookEntry entry);

  /**
   * All entries in insertion order.
   */
  List<NotebookEntry> read();

  /**
   * Entries whose sequence is strictly greater than {@code sequence}.
   */
  List<NotebookEntry> readSince(long sequence);
}
