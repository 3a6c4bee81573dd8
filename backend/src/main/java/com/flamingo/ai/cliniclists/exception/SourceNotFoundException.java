package com.flamingo.ai.cliniclists.exception;

/** Exception thrown when a source document does not exist in the owner's folder. */
public class SourceNotFoundException extends RuntimeException {

  private final String ownerId;
  private final String key;

  public SourceNotFoundException(String ownerId, String key) {
    super("Source document not found for owner " + ownerId + ": " + key);
    this.ownerId = ownerId;
    this.key = key;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public String getKey() {
    return key;
  }
}
