package com.flamingo.ai.cliniclists.service.category;

/**
 * A top-level heading of a document with the number of times it occurs.
 *
 * @param category heading text
 * @param count occurrences, 0 when the reply gave none
 */
public record MarkdownCategory(String category, int count) {}
