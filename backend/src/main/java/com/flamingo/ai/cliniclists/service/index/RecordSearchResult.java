package com.flamingo.ai.cliniclists.service.index;

import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import java.util.List;

/**
 * One page of search hits.
 *
 * @param total total matching records
 * @param hits records on this page, sorted by file name then page
 */
public record RecordSearchResult(long total, List<ClinicalRecord> hits) {

  public RecordSearchResult {
    hits = hits == null ? List.of() : List.copyOf(hits);
  }
}
