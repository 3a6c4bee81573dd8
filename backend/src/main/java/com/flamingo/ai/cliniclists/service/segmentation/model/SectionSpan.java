package com.flamingo.ai.cliniclists.service.segmentation.model;

/**
 * Half-open character range {@code [start, end)} of one located section within the full document
 * text.
 *
 * @param headingOffset offset of the heading line that introduced the section
 * @param start offset of the first character after the heading line
 * @param end exclusive end offset
 */
public record SectionSpan(int headingOffset, int start, int end) {

  public SectionSpan {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid section span [" + start + ", " + end + ")");
    }
  }

  public String slice(String fullText) {
    return fullText.substring(start, end);
  }
}
