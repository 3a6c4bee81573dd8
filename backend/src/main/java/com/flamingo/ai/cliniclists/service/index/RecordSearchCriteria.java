package com.flamingo.ai.cliniclists.service.index;

import lombok.Builder;

/**
 * Filters for an owner-scoped record search. Null fields do not filter.
 *
 * @param query free text matched against name, content and markdown
 * @param category exact category
 * @param fileName exact source file name
 * @param page exact page number
 * @param from offset of the first hit
 * @param size maximum hits returned
 */
@Builder
public record RecordSearchCriteria(
    String query, String category, String fileName, Integer page, int from, int size) {

  static final int DEFAULT_SIZE = 50;

  public RecordSearchCriteria {
    from = Math.max(from, 0);
    size = size <= 0 ? DEFAULT_SIZE : size;
  }
}
