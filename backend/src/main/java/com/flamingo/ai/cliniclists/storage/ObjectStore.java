package com.flamingo.ai.cliniclists.storage;

import java.util.List;
import java.util.Optional;

/**
 * Key/value store for source copies, results documents, list artifacts and observation files.
 *
 * <p>Keys are {@code /}-separated relative paths such as {@code owner/Lists/file_results.json}.
 * Implementations throw {@link com.flamingo.ai.cliniclists.exception.StorageException} on I/O
 * failure.
 */
public interface ObjectStore {

  /** Returns the object's bytes, or empty when no object exists at the key. */
  Optional<byte[]> get(String key);

  /** Creates or replaces the object at the key. */
  void put(String key, byte[] content);

  /** Lists keys under the prefix, recursively, in lexical order. */
  List<String> list(String prefix);

  /**
   * Deletes the object at the key.
   *
   * @return whether an object existed
   */
  boolean delete(String key);
}
