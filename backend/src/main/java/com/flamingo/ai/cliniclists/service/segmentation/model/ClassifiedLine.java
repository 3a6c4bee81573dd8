package com.flamingo.ai.cliniclists.service.segmentation.model;

/**
 * A trimmed section line with its tag.
 *
 * @param text trimmed line text
 * @param tag classification
 * @param recordName captured name for record tags, otherwise empty
 * @param recordValue captured dosage for {@link LineTag#RECORD_WITH_VALUE}, otherwise empty
 */
public record ClassifiedLine(String text, LineTag tag, String recordName, String recordValue) {

  public ClassifiedLine {
    recordName = recordName == null ? "" : recordName;
    recordValue = recordValue == null ? "" : recordValue;
  }

  public static ClassifiedLine of(String text, LineTag tag) {
    return new ClassifiedLine(text, tag, "", "");
  }
}
