package com.flamingo.ai.cliniclists.service.document;

/**
 * One page of a decoded source document.
 *
 * @param pageNumber 1-based page number
 * @param text plain page text
 * @param markdown page content as markdown
 */
public record DocumentPage(int pageNumber, String text, String markdown) {

  public DocumentPage {
    if (pageNumber < 1) {
      throw new IllegalArgumentException("pageNumber must be positive: " + pageNumber);
    }
    text = text == null ? "" : text;
    markdown = markdown == null ? "" : markdown;
  }
}
