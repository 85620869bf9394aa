package com.flamingo.ai.chatsearch.exception;

/** Exception thrown when a caller's query intent is malformed. Raised before any I/O. */
public class InvalidIntentException extends RuntimeException {

  public InvalidIntentException(String message) {
    super(message);
  }
}
