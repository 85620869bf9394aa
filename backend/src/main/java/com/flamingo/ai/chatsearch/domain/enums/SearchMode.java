package com.flamingo.ai.chatsearch.domain.enums;

/** How a query is matched against the index. */
public enum SearchMode {
  /** Keyword matching on analyzed text fields. */
  LEXICAL,

  /** Cosine similarity between the context vector and the stored content vector. */
  SEMANTIC
}
