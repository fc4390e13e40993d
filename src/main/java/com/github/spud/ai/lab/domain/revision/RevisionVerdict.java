package com.github.spud.ai.lab.domain.revision;

public enum RevisionVerdict {
  PENDING,
  APPROVED,
  REVISE
}
