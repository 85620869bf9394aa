package com.flamingo.ai.chatsearch.exception;

/**
 * Base exception for search failures that are not the caller's fault.
 *
 * <p>Carries a message safe to show to API clients alongside the technical one.
 */
public class SearchException extends RuntimeException {

  static final String DEFAULT_USER_MESSAGE =
      "Search is temporarily unavailable. Please try again.";

  private final String userMessage;

  public SearchException(String message, Throwable cause) {
    this(message, DEFAULT_USER_MESSAGE, cause);
  }

  public SearchException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
