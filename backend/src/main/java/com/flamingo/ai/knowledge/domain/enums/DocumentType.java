package com.flamingo.ai.knowledge.domain.enums;

/** Source kind of a knowledge-base document. */
public enum DocumentType {
  FILE,
  URL,
  RICH_TEXT
}
