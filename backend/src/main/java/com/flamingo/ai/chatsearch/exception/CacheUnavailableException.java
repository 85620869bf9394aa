package com.flamingo.ai.chatsearch.exception;

/** Exception thrown by a cache store when the underlying key-value store cannot be reached. */
public class CacheUnavailableException extends RuntimeException {

  public CacheUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
