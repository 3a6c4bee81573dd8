package com.flamingo.ai.cliniclists.service.index;

import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.exception.IndexUnavailableException;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Stands in for the search index when Elasticsearch is disabled. */
@Component
@ConditionalOnProperty(name = "elasticsearch.enabled", havingValue = "false", matchIfMissing = true)
public class UnavailableClinicalRecordIndex implements ClinicalRecordIndex {

  static final String MESSAGE = "Clinical Notes indexing not configured";

  @Override
  public boolean isAvailable() {
    return false;
  }

  @Override
  public BulkIndexOutcome bulkIndex(String ownerId, List<ClinicalRecord> records) {
    throw new IndexUnavailableException(MESSAGE);
  }

  @Override
  public long deleteByFile(String ownerId, String fileName) {
    throw new IndexUnavailableException(MESSAGE);
  }

  @Override
  public RecordSearchResult query(String ownerId, RecordSearchCriteria criteria) {
    throw new IndexUnavailableException(MESSAGE);
  }
}
