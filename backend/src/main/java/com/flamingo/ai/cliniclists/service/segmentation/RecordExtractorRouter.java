package com.flamingo.ai.cliniclists.service.segmentation;

import com.flamingo.ai.cliniclists.domain.enums.RecordCategory;
import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.service.segmentation.model.PageBlock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Picks the extractor registered for a category. */
@Component
public class RecordExtractorRouter {

  private final Map<RecordCategory, RecordExtractor> extractors =
      new EnumMap<>(RecordCategory.class);

  public RecordExtractorRouter(List<RecordExtractor> registered) {
    for (RecordExtractor extractor : registered) {
      RecordExtractor previous = extractors.put(extractor.category(), extractor);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate record extractor for category " + extractor.category());
      }
    }
  }

  public List<ClinicalRecord> extract(
      RecordCategory category, String fullText, List<PageBlock> blocks, String sourceFile) {
    RecordExtractor extractor = extractors.get(category);
    if (extractor == null) {
      throw new IllegalStateException("No record extractor registered for " + category);
    }
    return extractor.extract(fullText, blocks, sourceFile);
  }
}
