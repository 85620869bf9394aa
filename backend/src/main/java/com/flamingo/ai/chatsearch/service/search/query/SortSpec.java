package com.flamingo.ai.chatsearch.service.search.query;

/** Sort on a single field. */
public record SortSpec(String field, Direction direction) {

  public enum Direction {
    ASC,
    DESC
  }

  public static SortSpec desc(String field) {
    return new SortSpec(field, Direction.DESC);
  }
}
