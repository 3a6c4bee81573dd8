package com.flamingo.ai.cliniclists.service.index;

import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import java.util.List;

/**
 * Searchable store of finished records. Every operation is scoped to one owner; records of one
 * owner are never visible to, or overwritten by, another.
 */
public interface ClinicalRecordIndex {

  /** Whether an index is configured. When false every other operation throws. */
  boolean isAvailable();

  /**
   * Adds or replaces records for the owner.
   *
   * @return how many records were stored and the per-record errors
   */
  BulkIndexOutcome bulkIndex(String ownerId, List<ClinicalRecord> records);

  /**
   * Removes every record the owner has for the file.
   *
   * @return number of records removed
   */
  long deleteByFile(String ownerId, String fileName);

  RecordSearchResult query(String ownerId, RecordSearchCriteria criteria);
}
