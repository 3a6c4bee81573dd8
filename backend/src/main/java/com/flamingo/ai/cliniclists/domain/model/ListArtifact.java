package com.flamingo.ai.cliniclists.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted record list for one (owner, source file, category) key.
 *
 * <p>A later processing run replaces the artifact at the same key rather than mutating it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListArtifact {

  private String categoryName;
  private String sourceFile;
  @Builder.Default private List<ClinicalRecord> records = new ArrayList<>();
  private IndexResult indexResult;
  private Instant processedAt;

  /** Processing timestamp of the source document this list was derived from. */
  private Instant sourceProcessedAt;

  /** Whether a source processed at {@code sourceTimestamp} still matches this artifact. */
  public boolean isFreshFor(Instant sourceTimestamp) {
    Instant recorded = sourceProcessedAt != null ? sourceProcessedAt : Instant.EPOCH;
    Instant current = sourceTimestamp != null ? sourceTimestamp : Instant.EPOCH;
    return !current.isAfter(recorded);
  }
}
