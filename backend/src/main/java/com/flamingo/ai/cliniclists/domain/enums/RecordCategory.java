package com.flamingo.ai.cliniclists.domain.enums;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Categories that can be processed into record lists on demand. */
public enum RecordCategory {
  MEDICATIONS("Medications", "med", List.of("Medication Record", "Medication"), false),
  CLINICAL_NOTES("Clinical Notes", "note", List.of("Clinical Note"), true);

  private final String displayName;
  private final String idPrefix;
  private final List<String> headingLabels;
  private final boolean indexBacked;

  RecordCategory(
      String displayName, String idPrefix, List<String> headingLabels, boolean indexBacked) {
    this.displayName = displayName;
    this.idPrefix = idPrefix;
    this.headingLabels = headingLabels;
    this.indexBacked = indexBacked;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getIdPrefix() {
    return idPrefix;
  }

  /** Heading labels searched for, in priority order. Each label also matches its plural form. */
  public List<String> getHeadingLabels() {
    return headingLabels;
  }

  /** Whether processed records are also written to the search index. */
  public boolean isIndexBacked() {
    return indexBacked;
  }

  /**
   * Resolves a user-supplied category name such as "Medication Records" or "Clinical Notes".
   *
   * @param categoryName free-form category name
   * @return the matching category, or empty when the name is not supported
   */
  public static Optional<RecordCategory> fromName(String categoryName) {
    if (categoryName == null) {
      return Optional.empty();
    }
    String normalized = categoryName.toLowerCase(Locale.ROOT);
    if (normalized.contains("clinical notes")) {
      return Optional.of(CLINICAL_NOTES);
    }
    if (normalized.contains("medication")) {
      return Optional.of(MEDICATIONS);
    }
    return Optional.empty();
  }
}
