package com.flamingo.ai.cliniclists.exception;

/** Exception thrown when the object store fails to read, write, list or delete. */
public class StorageException extends RuntimeException {

  private final String key;

  public StorageException(String message, String key, Throwable cause) {
    super(message + ": " + key, cause);
    this.key = key;
  }

  public StorageException(String message, String key) {
    super(message + ": " + key);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
