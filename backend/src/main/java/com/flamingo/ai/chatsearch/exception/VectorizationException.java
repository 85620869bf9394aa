package com.flamingo.ai.chatsearch.exception;

/** Exception thrown when text cannot be turned into a meaningful feature vector. */
public class VectorizationException extends RuntimeException {

  /** Why vectorization failed. */
  public enum Reason {
    BLANK_TEXT,
    NO_KNOWN_TERMS,
    MODEL_FAILURE
  }

  private final Reason reason;

  public VectorizationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public VectorizationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }

  /** True when the input text, not the vectorizer, is the problem. */
  public boolean isInputError() {
    return reason != Reason.MODEL_FAILURE;
  }
}
