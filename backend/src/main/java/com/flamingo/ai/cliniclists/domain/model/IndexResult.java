package com.flamingo.ai.cliniclists.domain.model;

import java.util.List;

/**
 * Outcome of forwarding a freshly segmented record list to the search index for one (owner, file)
 * pair.
 *
 * @param total records produced by segmentation
 * @param indexed records the index accepted
 * @param errors per-item or whole-request failure messages
 * @param deleted records removed for the file before re-insertion
 */
public record IndexResult(int total, int indexed, List<String> errors, long deleted) {

  public IndexResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  /** Result for categories that are extracted but never sent to the index. */
  public static IndexResult notIndexed(int total) {
    return new IndexResult(total, total, List.of(), 0);
  }
}
