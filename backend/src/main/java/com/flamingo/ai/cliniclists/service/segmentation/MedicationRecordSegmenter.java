package com.flamingo.ai.cliniclists.service.segmentation;

import com.flamingo.ai.cliniclists.config.ListsConfig;
import com.flamingo.ai.cliniclists.domain.enums.RecordCategory;
import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.service.segmentation.model.ClassifiedLine;
import com.flamingo.ai.cliniclists.service.segmentation.model.LineTag;
import com.flamingo.ai.cliniclists.service.segmentation.model.SegmenterState;
import com.flamingo.ai.cliniclists.service.segmentation.model.SegmenterState.Phase;
import com.flamingo.ai.cliniclists.service.segmentation.model.SegmenterState.RecordDraft;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns one filtered medication section into dated records.
 *
 * <p>A record needs a controlling date line followed, within a bounded number of lines, by a line
 * naming the medication. Page markers and header/footer lines between the date and the record
 * abandon both the date and any record opened under it. The state between lines is an explicit
 * {@link SegmenterState} folded over the classified lines.
 */
@Component
@Slf4j
public class MedicationRecordSegmenter {

  private static final List<Pattern> INVALID_NAMES =
      List.of(
          Pattern.compile("^Page\\s+\\d+", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^##\\s*Page", Pattern.CASE_INSENSITIVE),
          Pattern.compile("Continued\\s+(on|from)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("Date\\s+of\\s+Birth", Pattern.CASE_INSENSITIVE),
          Pattern.compile("Health\\s+Page", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^[A-Z][a-z]+\\s+Page", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\d+\\s*$"),
          Pattern.compile("^[A-Z]{1,3}\\s*$", Pattern.CASE_INSENSITIVE));

  private static final Pattern DIGITS_ONLY = Pattern.compile("^\\d+$");

  private final LineClassifier lineClassifier;
  private final int maxLinesWithoutRecord;

  public MedicationRecordSegmenter(LineClassifier lineClassifier, ListsConfig listsConfig) {
    this.lineClassifier = lineClassifier;
    this.maxLinesWithoutRecord = listsConfig.getSegmentation().getMaxLinesWithoutRecord();
  }

  /**
   * Segments one filtered section.
   *
   * @param filteredSection section text after boilerplate filtering
   * @param sourceFile file name stamped on every record and used in its id
   * @param sectionIndex position of the section in the document, keeps ids unique across sections
   * @return records in the order of their controlling date lines
   */
  public List<ClinicalRecord> segment(String filteredSection, String sourceFile, int sectionIndex) {
    List<ClassifiedLine> lines =
        Arrays.stream(filteredSection.split("\n", -1)).map(lineClassifier::classify).toList();
    List<RecordDraft> drafts = fold(lines);

    String idBase =
        sourceFile + "-" + RecordCategory.MEDICATIONS.getIdPrefix() + "-" + sectionIndex + "-";
    List<ClinicalRecord> records = new ArrayList<>(drafts.size());
    for (int i = 0; i < drafts.size(); i++) {
      records.add(toRecord(drafts.get(i), idBase + i, sourceFile));
    }
    log.debug(
        "Segmented {} medication record(s) from section {} of {}",
        records.size(),
        sectionIndex,
        sourceFile);
    return records;
  }

  /** Runs the state machine over already classified lines and returns the flushed drafts. */
  @VisibleForTesting
  List<RecordDraft> fold(List<ClassifiedLine> lines) {
    List<RecordDraft> emitted = new ArrayList<>();
    SegmenterState state = SegmenterState.seekingDate();
    for (ClassifiedLine line : lines) {
      state = step(state, line, emitted);
    }
    flush(state, emitted);
    return emitted;
  }

  private SegmenterState step(SegmenterState state, ClassifiedLine line, List<RecordDraft> out) {
    LineTag tag = line.tag();
    if (tag == LineTag.BLANK) {
      return state;
    }
    if (tag == LineTag.DATE) {
      flush(state, out);
      return SegmenterState.haveDate(line.text());
    }
    if (state.phase() == Phase.SEEKING_DATE) {
      return state;
    }

    int linesSinceDate = state.linesSinceDate() + 1;
    if (state.phase() == Phase.HAVE_DATE_NO_RECORD && linesSinceDate > maxLinesWithoutRecord) {
      return SegmenterState.seekingDate();
    }
    if (tag.abandonsDate()) {
      return SegmenterState.seekingDate();
    }
    if (tag == LineTag.LOCATION || tag == LineTag.OUT_OF_BOUNDS_LENGTH) {
      return state.withLinesSinceDate(linesSinceDate);
    }

    if (state.phase() == Phase.HAVE_DATE_NO_RECORD) {
      if (tag.opensRecord() && isValidName(line.recordName())) {
        return state.withRecord(
            new RecordDraft(state.date(), line.recordName(), line.recordValue(), line.text()));
      }
      return state.withLinesSinceDate(linesSinceDate);
    }

    RecordDraft draft = state.draft();
    if (draft.value().isEmpty()) {
      RecordDraft updated =
          lineClassifier
              .findValue(line.text())
              .map(value -> draft.fillValue(value, line.text()))
              .orElseGet(() -> draft.append(line.text()));
      return state.withDraft(updated, linesSinceDate);
    }
    return state.withDraft(draft.append(line.text()), linesSinceDate);
  }

  private static void flush(SegmenterState state, List<RecordDraft> out) {
    if (state.phase() == Phase.HAVE_RECORD && state.hasOpenRecord()) {
      out.add(state.draft());
    }
  }

  static boolean isValidName(String name) {
    if (name == null || name.length() < 2 || DIGITS_ONLY.matcher(name).matches()) {
      return false;
    }
    return INVALID_NAMES.stream().noneMatch(p -> p.matcher(name).find());
  }

  private static ClinicalRecord toRecord(RecordDraft draft, String id, String sourceFile) {
    return ClinicalRecord.builder()
        .id(id)
        .name(draft.name())
        .value(draft.value())
        .date(draft.date())
        .sourceFile(sourceFile)
        .category(RecordCategory.MEDICATIONS.getDisplayName())
        .rawContent(draft.content())
        .rawMarkdown(draft.content())
        .build();
  }
}
