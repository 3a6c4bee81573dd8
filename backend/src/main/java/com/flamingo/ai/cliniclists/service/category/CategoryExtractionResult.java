package com.flamingo.ai.cliniclists.service.category;

import java.util.List;

/**
 * Categories found in a document, or the reason none could be listed.
 *
 * @param categories parsed categories in reply order
 * @param categoryError message of the absorbed failure, {@code null} on success
 */
public record CategoryExtractionResult(List<MarkdownCategory> categories, String categoryError) {

  public CategoryExtractionResult {
    categories = categories == null ? List.of() : List.copyOf(categories);
  }

  public static CategoryExtractionResult success(List<MarkdownCategory> categories) {
    return new CategoryExtractionResult(categories, null);
  }

  public static CategoryExtractionResult failure(String categoryError) {
    return new CategoryExtractionResult(List.of(), categoryError);
  }

  public boolean hasError() {
    return categoryError != null;
  }
}
