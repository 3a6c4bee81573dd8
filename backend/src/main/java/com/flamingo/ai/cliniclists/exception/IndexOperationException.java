package com.flamingo.ai.cliniclists.exception;

/** Exception thrown when a configured search index fails an operation. */
public class IndexOperationException extends RuntimeException {

  private final String userMessage;

  public IndexOperationException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search index is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
