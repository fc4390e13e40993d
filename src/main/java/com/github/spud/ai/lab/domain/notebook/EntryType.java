package com.github.spud.ai.lab.domain.notebook;

public enum EntryType {
  PLAN,
  NOTE,
  OUTPUT,
  COMPLETION
}
