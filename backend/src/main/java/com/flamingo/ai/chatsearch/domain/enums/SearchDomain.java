package com.flamingo.ai.chatsearch.domain.enums;

import java.util.Arrays;

/** The document collections served by the search service. */
public enum SearchDomain {
  MESSAGES("messages"),
  USERS("users"),
  ROOMS("rooms");

  private final String tag;

  SearchDomain(String tag) {
    this.tag = tag;
  }

  /** Stable lowercase tag used in cache keys and payloads. */
  public String getTag() {
    return tag;
  }

  public static SearchDomain fromTag(String tag) {
    return Arrays.stream(values())
        .filter(d -> d.tag.equals(tag))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown search domain: " + tag));
  }
}
