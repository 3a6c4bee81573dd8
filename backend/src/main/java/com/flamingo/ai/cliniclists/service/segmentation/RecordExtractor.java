package com.flamingo.ai.cliniclists.service.segmentation;

import com.flamingo.ai.cliniclists.domain.enums.RecordCategory;
import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.service.segmentation.model.PageBlock;
import java.util.List;

/** Extracts the records of one category from a whole document. */
public interface RecordExtractor {

  RecordCategory category();

  /**
   * Locates the category's sections, cleans and segments them, and assigns page numbers.
   *
   * @param fullText the full document text
   * @param blocks page blocks whose lengths add up to {@code fullText.length()}
   * @param sourceFile file name stamped on every record
   * @return records in document order; empty when no section is present
   */
  List<ClinicalRecord> extract(String fullText, List<PageBlock> blocks, String sourceFile);
}
