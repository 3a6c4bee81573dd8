package com.flamingo.ai.cliniclists.service.segmentation.model;

/** Classification of one section line, listed in the order the classifier checks them. */
public enum LineTag {
  BLANK,
  DATE,
  LOCATION,
  PAGE_MARKER,
  HEADER_FOOTER,
  OUT_OF_BOUNDS_LENGTH,
  RECORD_WITH_VALUE,
  RECORD_NAME_ONLY,
  CONTINUATION;

  /** Tags whose presence shows the pending date did not introduce a real record. */
  public boolean abandonsDate() {
    return this == PAGE_MARKER || this == HEADER_FOOTER;
  }

  public boolean opensRecord() {
    return this == RECORD_WITH_VALUE || this == RECORD_NAME_ONLY;
  }
}
