package com.flamingo.ai.cliniclists.service.segmentation;

import com.flamingo.ai.cliniclists.config.ListsConfig;
import com.flamingo.ai.cliniclists.domain.enums.RecordCategory;
import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.service.segmentation.model.PageBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits one filtered Clinical Notes section into individual notes.
 *
 * <p>Every {@code Created:} line marks one note. The note starts at the closest date line above it
 * (within a bounded look-back) and runs to the start of the next note. Structured header lines are
 * lifted into record fields and removed from the body.
 */
@Component
@Slf4j
public class ClinicalNoteSegmenter {

  private static final String DEFAULT_NAME = "Clinical Note";

  private static final Pattern CREATED =
      Pattern.compile("^Created:\\s*(.+)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern CREATED_START =
      Pattern.compile("^Created:\\s+", Pattern.CASE_INSENSITIVE);
  private static final Pattern TYPE = Pattern.compile("^Type:\\s*(.+)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern CATEGORY =
      Pattern.compile("^Category:\\s*(.+)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern AUTHOR =
      Pattern.compile("^Author:\\s*(.+)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern AT_TIME = Pattern.compile("\\s+at\\s+", Pattern.CASE_INSENSITIVE);
  private static final Pattern PAGE_NUMBER =
      Pattern.compile("^Page\\s+\\d+$|^\\d+$", Pattern.CASE_INSENSITIVE);

  private static final List<Pattern> LOCATIONS =
      List.of(
          Pattern.compile("mass general", Pattern.CASE_INSENSITIVE),
          Pattern.compile("brigham", Pattern.CASE_INSENSITIVE),
          Pattern.compile("hospital", Pattern.CASE_INSENSITIVE),
          Pattern.compile("medical center", Pattern.CASE_INSENSITIVE),
          Pattern.compile("clinic", Pattern.CASE_INSENSITIVE));

  private static final int STANDALONE_DATE_MAX_LENGTH = 30;

  private final PageMapper pageMapper;
  private final int lookbackLines;
  private final int minNoteLength;

  public ClinicalNoteSegmenter(PageMapper pageMapper, ListsConfig listsConfig) {
    this.pageMapper = pageMapper;
    this.lookbackLines = listsConfig.getSegmentation().getNoteLookbackLines();
    this.minNoteLength = listsConfig.getSegmentation().getMinNoteLength();
  }

  /**
   * Extracts notes from one section.
   *
   * @param filteredSection section text after boilerplate filtering
   * @param sourceFile file name stamped on every note
   * @param sectionStart offset of the section in the full document, used for page lookup
   * @param blocks page blocks of the full document
   * @param firstNoteNumber number given to the first note, so numbering continues across sections
   * @return notes in document order
   */
  public List<ClinicalRecord> segment(
      String filteredSection,
      String sourceFile,
      int sectionStart,
      List<PageBlock> blocks,
      int firstNoteNumber) {
    String[] lines = filteredSection.split("\n", -1);
    List<Integer> starts = findNoteStarts(lines);

    List<ClinicalRecord> notes = new ArrayList<>();
    for (int i = 0; i < starts.size(); i++) {
      int startLine = starts.get(i);
      int endLine = i < starts.size() - 1 ? starts.get(i + 1) : lines.length;
      NoteFields fields = parseNote(lines, startLine, endLine);
      if (fields.body.length() < minNoteLength) {
        continue;
      }

      int offset = sectionStart + offsetOfLine(lines, startLine);
      int number = firstNoteNumber + notes.size();
      int page = pageMapper.pageForOffsetOrLast(blocks, offset);
      notes.add(toRecord(fields, sourceFile, number, page));
    }

    log.debug(
        "Extracted {} clinical note(s) from {} note start(s) in {}",
        notes.size(),
        starts.size(),
        sourceFile);
    return notes;
  }

  List<Integer> findNoteStarts(String[] lines) {
    List<Integer> starts = new ArrayList<>();
    for (int i = 0; i < lines.length; i++) {
      if (!CREATED_START.matcher(lines[i].trim()).find()) {
        continue;
      }
      int start = i;
      for (int j = i - 1; j >= Math.max(0, i - lookbackLines); j--) {
        String previous = lines[j].trim();
        if (previous.isEmpty()) {
          continue;
        }
        if (CREATED_START.matcher(previous).find()) {
          break;
        }
        if (LineClassifier.isDate(previous)) {
          start = j;
          break;
        }
      }
      starts.add(start);
    }
    starts.sort(Integer::compareTo);
    return starts;
  }

  private NoteFields parseNote(String[] lines, int startLine, int endLine) {
    NoteFields fields = new NoteFields();
    List<String> bodyLines = new ArrayList<>();
    for (int j = startLine; j < endLine; j++) {
      String line = lines[j].trim();
      if (line.isEmpty()) {
        bodyLines.add("");
        continue;
      }
      Matcher matcher;
      if ((matcher = TYPE.matcher(line)).find()) {
        fields.type = matcher.group(1).trim();
        continue;
      }
      if ((matcher = CATEGORY.matcher(line)).find()) {
        fields.category = matcher.group(1).trim();
        continue;
      }
      if ((matcher = AUTHOR.matcher(line)).find()) {
        fields.author = matcher.group(1).trim();
        continue;
      }
      if ((matcher = CREATED.matcher(line)).find()) {
        fields.created = matcher.group(1).trim();
        fields.date = AT_TIME.split(fields.created, 2)[0].trim();
        continue;
      }

      boolean standaloneDate =
          line.length() < STANDALONE_DATE_MAX_LENGTH && LineClassifier.isDate(line);
      if (!standaloneDate && !PAGE_NUMBER.matcher(line).find()) {
        bodyLines.add(lines[j]);
      }
      if (fields.date.isEmpty()) {
        fields.date = firstDate(line);
      }
      for (Pattern location : LOCATIONS) {
        Matcher locationMatcher = location.matcher(line);
        if (locationMatcher.find()) {
          fields.location = locationMatcher.group();
          break;
        }
      }
    }
    fields.body = String.join("\n", bodyLines).trim();
    return fields;
  }

  private static String firstDate(String line) {
    for (Pattern pattern : LineClassifier.DATE_PATTERNS) {
      Matcher matcher = pattern.matcher(line);
      if (matcher.find()) {
        return matcher.group();
      }
    }
    return "";
  }

  private static int offsetOfLine(String[] lines, int lineIndex) {
    int offset = 0;
    for (int j = 0; j < lineIndex; j++) {
      offset += lines[j].length() + 1;
    }
    return offset;
  }

  private static ClinicalRecord toRecord(
      NoteFields fields, String sourceFile, int number, int page) {
    String name =
        !fields.type.isEmpty()
            ? fields.type
            : !fields.category.isEmpty() ? fields.category : DEFAULT_NAME;
    String category =
        fields.category.isEmpty()
            ? RecordCategory.CLINICAL_NOTES.getDisplayName()
            : fields.category;
    return ClinicalRecord.builder()
        .id(sourceFile + "-" + RecordCategory.CLINICAL_NOTES.getIdPrefix() + "-" + number)
        .name(name)
        .date(fields.date)
        .sourceFile(sourceFile)
        .page(page)
        .category(category)
        .rawContent(MarkdownText.toPlainText(fields.body))
        .rawMarkdown(fields.body)
        .location(fields.location)
        .noteType(fields.type)
        .author(fields.author)
        .created(fields.created)
        .build();
  }

  private static final class NoteFields {
    private String type = "";
    private String category = "";
    private String author = "";
    private String created = "";
    private String date = "";
    private String location = "";
    private String body = "";
  }
}
