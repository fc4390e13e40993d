package com.github.spud.ai.lab.domain.notebook;

public enum AuthorTeam {
  PLANNING,
  IMPLEMENTATION,
  SYSTEM
}
