package com.flamingo.ai.chatsearch.exception;

import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;

/**
 * Exception thrown when the search backend cannot serve an index or search call.
 *
 * <p>Covers transport failures, timeouts and an open circuit breaker. This layer never retries;
 * retry policy belongs to the client transport.
 */
public class BackendUnavailableException extends SearchException {

  private final SearchDomain domain;

  public BackendUnavailableException(SearchDomain domain, String message, Throwable cause) {
    super(message, cause);
    this.domain = domain;
  }

  public SearchDomain getDomain() {
    return domain;
  }
}
