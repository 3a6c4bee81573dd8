package com.flamingo.ai.cliniclists.service.lists;

import java.util.List;

/**
 * One observation written to a category file.
 *
 * @param date raw date text, empty for undated observations
 * @param display markdown shown for the observation
 * @param page page the observation starts on
 * @param outOfRangeLines flagged lab lines, empty for other categories
 */
public record CategoryObservation(
    String date, String display, int page, List<String> outOfRangeLines) {

  public CategoryObservation {
    outOfRangeLines = outOfRangeLines == null ? List.of() : List.copyOf(outOfRangeLines);
  }
}
