package com.flamingo.ai.cliniclists.service.segmentation.model;

/**
 * Length of one page as it was concatenated into the full document text, including its {@code ##
 * Page N} heading and the trailing separator.
 *
 * @param pageNumber 1-based page number
 * @param renderedLength characters this page occupies in the full text
 */
public record PageBlock(int pageNumber, int renderedLength) {

  public PageBlock {
    if (pageNumber < 1) {
      throw new IllegalArgumentException("pageNumber must be positive: " + pageNumber);
    }
    if (renderedLength < 0) {
      throw new IllegalArgumentException("renderedLength must not be negative: " + renderedLength);
    }
  }
}
