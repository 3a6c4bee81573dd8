package com.flamingo.ai.cliniclists.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One structured entry extracted from a located section: a medication line or a clinical note.
 *
 * <p>{@code date} keeps the raw matched text; parsing is left to presentation. {@code page} is
 * filled in after segmentation by the page mapper.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ClinicalRecord {

  private String id;

  /** Medication name or note title. Never blank and never purely numeric. */
  private String name;

  /** Dosage for medications; empty when none was found. */
  @Builder.Default private String value = "";

  @Builder.Default private String date = "";
  private String sourceFile;
  @Builder.Default private int page = 1;
  private String category;
  private String rawContent;
  private String rawMarkdown;

  // Clinical note fields
  @Builder.Default private String location = "";
  @Builder.Default private String noteType = "";
  @Builder.Default private String author = "";
  @Builder.Default private String created = "";
}
