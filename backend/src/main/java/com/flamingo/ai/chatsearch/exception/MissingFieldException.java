package com.flamingo.ai.chatsearch.exception;

import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;

/** Exception thrown when a document is missing a required attribute at index time. */
public class MissingFieldException extends RuntimeException {

  private final SearchDomain domain;
  private final String field;

  public MissingFieldException(SearchDomain domain, String field) {
    super("Missing required field '" + field + "' for " + domain.getTag() + " document");
    this.domain = domain;
    this.field = field;
  }

  public SearchDomain getDomain() {
    return domain;
  }

  public String getField() {
    return field;
  }
}
