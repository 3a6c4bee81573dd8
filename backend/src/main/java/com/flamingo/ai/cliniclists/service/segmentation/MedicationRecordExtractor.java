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
public class MedicationRecordExtractor implements RecordExtractor {

  private final SectionLocator sectionLocator;
  private final BoilerplateFilter boilerplateFilter;
  private final MedicationRecordSegmenter segmenter;
  private final PageMapper pageMapper;

  @Override
  public RecordCategory category() {
    return RecordCategory.MEDICATIONS;
  }

  @Override
  public List<ClinicalRecord> extract(
      String fullText, List<PageBlock> blocks, String sourceFile) {
    List<SectionSpan> spans =
        sectionLocator.locate(fullText, RecordCategory.MEDICATIONS.getHeadingLabels());
    if (spans.isEmpty()) {
      log.info("No Medication Records section found in {}", sourceFile);
      return List.of();
    }

    List<ClinicalRecord> records = new ArrayList<>();
    for (int i = 0; i < spans.size(); i++) {
      String filtered = boilerplateFilter.filter(spans.get(i).slice(fullText));
      records.addAll(segmenter.segment(filtered, sourceFile, i));
    }

    log.info(
        "Extracted {} medication record(s) from {} section(s) of {}",
        records.size(),
        spans.size(),
        sourceFile);
    return pageMapper.assignPages(records, fullText, spans, blocks);
  }
}
