package com.flamingo.ai.cliniclists.exception;

/** Exception thrown when an operation needs the search index but none is configured. */
public class IndexUnavailableException extends RuntimeException {

  private final String userMessage;

  public IndexUnavailableException(String message) {
    super(message);
    this.userMessage = message;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
