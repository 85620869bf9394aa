package com.flamingo.ai.chatsearch.exception;

/** Exception thrown when a cached payload fails to decode or validate. */
public class MalformedCacheEntryException extends RuntimeException {

  public MalformedCacheEntryException(String message) {
    super(message);
  }

  public MalformedCacheEntryException(String message, Throwable cause) {
    super(message, cause);
  }
}
