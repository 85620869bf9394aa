package com.flamingo.ai.chatsearch.service.search.query;

/** Exact-match (term-level) filter. Never analyzed, never scored. */
public record FilterClause(String field, Object value) {}
