package com.flamingo.ai.cliniclists.service.segmentation;

import com.flamingo.ai.cliniclists.domain.enums.RecordCategory;
import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.service.segmentation.model.PageBlock;
import com.flamingo.ai.cliniclists.service.segmentation.model.SectionSpan;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ClinicalNoteExtractor implements RecordExtractor {

  private final SectionLocator sectionLocator;
  private final BoilerplateFilter boilerplateFilter;
  private final ClinicalNoteSegmenter segmenter;

  @Override
  public RecordCategory category() {
    return RecordCategory.CLINICAL_NOTES;
  }

  @Override
  public List<ClinicalRecord> extract(
      String fullText, List<PageBlock> blocks, String sourceFile) {
    List<SectionSpan> spans =
        sectionLocator.locate(fullText, RecordCategory.CLINICAL_NOTES.getHeadingLabels());
    if (spans.isEmpty()) {
      log.info("No Clinical Notes section found in {}", sourceFile);
      return List.of();
    }

    List<ClinicalRecord> notes = new ArrayList<>();
    for (SectionSpan span : spans) {
      String filtered = boilerplateFilter.filter(span.slice(fullText));
      notes.addAll(segmenter.segment(filtered, sourceFile, span.start(), blocks, notes.size() + 1));
    }

    log.info(
        "Extracted {} clinical note(s) from {} section(s) of {}",
        notes.size(),
        spans.size(),
        sourceFile);
    return notes;
  }
}
