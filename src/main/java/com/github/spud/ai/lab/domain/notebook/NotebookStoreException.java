package com.github.spud.ai.lab.domain.notebook;

/**
 * The notebook could not be read or written. Always fatal for a run.
 */
public class NotebookStoreException extends RuntimeException {

  public NotebookStoreException(String message) {
    super(message);
  }

  public NotebookStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
