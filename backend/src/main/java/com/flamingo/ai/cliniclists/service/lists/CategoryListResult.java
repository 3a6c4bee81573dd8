package com.flamingo.ai.cliniclists.service.lists;

import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.domain.model.IndexResult;
import java.time.Instant;
import java.util.List;

/**
 * Record list returned for a category request.
 *
 * @param categoryName category as requested
 * @param sourceFile source file the records came from
 * @param records records in document order
 * @param indexResult outcome of the index step
 * @param processedAt when the list was computed
 * @param fromCache whether the list was served from a stored artifact
 * @param cacheWriteError why the new list could not be stored, {@code null} when it was
 */
public record CategoryListResult(
    String categoryName,
    String sourceFile,
    List<ClinicalRecord> records,
    IndexResult indexResult,
    Instant processedAt,
    boolean fromCache,
    String cacheWriteError) {

  public CategoryListResult {
    records = records == null ? List.of() : List.copyOf(records);
  }
}
