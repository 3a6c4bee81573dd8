package com.flamingo.ai.cliniclists.service.lists;

import com.flamingo.ai.cliniclists.storage.ObjectStore;
import io.micrometer.core.annotation.Timed;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes one markdown file per {@code ###} category of a document, listing the category's dated
 * observations.
 *
 * <p>An observation starts at a date+place line (for example {@code Oct 27, 2025 Mass General})
 * inside its category and runs to the next one. Vitals and lab results are merged per date.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryObservationWriter {

  private static final Pattern DATE_PLACE =
      Pattern.compile("^[A-Z][a-z]{2}\\s+\\d{1,2},\\s+\\d{4}\\s+\\S+", Pattern.CASE_INSENSITIVE);
  private static final Pattern OBSERVATION_DATE =
      Pattern.compile("([A-Z][a-z]{2}\\s+\\d{1,2},\\s+\\d{4})");
  private static final Pattern PAGE_HEADING = Pattern.compile("^##\\s+Page\\s+(\\d+)$");
  private static final String CATEGORY_HEADING = "### ";

  private final ObjectStore objectStore;
  private final ListsStorageLayout layout;

  /**
   * Extracts observations per category and replaces the owner's category files.
   *
   * @return one entry per file written; categories without observations get no file
   */
  @Timed(value = "lists.observations.write", description = "Time to write category files")
  public List<ObservationFile> writeCategoryFiles(String ownerId, String fullMarkdown) {
    String[] lines = fullMarkdown.split("\n", -1);
    int[] pageAt = pagesByLine(lines);
    String[] datePlaceOwner = new String[lines.length];
    Map<String, int[]> ranges = categoryRanges(lines, datePlaceOwner);

    List<ObservationFile> files = new ArrayList<>();
    for (Map.Entry<String, int[]> entry : ranges.entrySet()) {
      String category = entry.getKey();
      List<CategoryObservation> observations =
          observationsFor(category, entry.getValue(), lines, pageAt, datePlaceOwner);
      if (observations.isEmpty()) {
        continue;
      }

      String key = layout.observationKey(ownerId, category);
      objectStore.delete(key);
      objectStore.put(key, render(category, observations).getBytes(StandardCharsets.UTF_8));
      files.add(new ObservationFile(category, key, observations.size()));
      log.debug("Wrote {} observation(s) to {}", observations.size(), key);
    }

    log.info("Wrote {} category file(s) for owner {}", files.size(), ownerId);
    return files;
  }

  private static int[] pagesByLine(String[] lines) {
    int[] pageAt = new int[lines.length];
    int page = 1;
    for (int i = 0; i < lines.length; i++) {
      Matcher matcher = PAGE_HEADING.matcher(lines[i].trim());
      if (matcher.matches()) {
        page = Integer.parseInt(matcher.group(1));
      }
      pageAt[i] = page;
    }
    return pageAt;
  }

  /**
   * Computes {@code [start, end]} line ranges per category and records which category owns each
   * date+place line. A repeated heading keeps the first start and extends the end.
   */
  private static Map<String, int[]> categoryRanges(String[] lines, String[] datePlaceOwner) {
    Map<String, int[]> ranges = new LinkedHashMap<>();
    String current = null;
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].trim();
      if (line.startsWith(CATEGORY_HEADING)) {
        if (current != null) {
          ranges.get(current)[1] = i - 1;
        }
        current = line.substring(CATEGORY_HEADING.length()).trim();
        int[] range = ranges.get(current);
        if (range == null) {
          ranges.put(current, new int[] {i, lines.length - 1});
        } else {
          range[1] = lines.length - 1;
        }
        continue;
      }
      if (current != null && DATE_PLACE.matcher(line).find()) {
        datePlaceOwner[i] = current;
      }
    }
    return ranges;
  }

  private static List<CategoryObservation> observationsFor(
      String category, int[] range, String[] lines, int[] pageAt, String[] datePlaceOwner) {
    ObservationStyle style = ObservationStyle.of(category);
    boolean labResults = category.toLowerCase(Locale.ROOT).contains("lab result");

    List<Integer> marks = new ArrayList<>();
    for (int i = range[0]; i <= range[1]; i++) {
      if (category.equals(datePlaceOwner[i])) {
        marks.add(i);
      }
    }

    List<CategoryObservation> observations = new ArrayList<>();
    Map<String, MergedDay> merged = new LinkedHashMap<>();
    for (int m = 0; m < marks.size(); m++) {
      int start = marks.get(m);
      Matcher dateMatcher = OBSERVATION_DATE.matcher(lines[start]);
      if (!dateMatcher.find()) {
        continue;
      }
      String date = dateMatcher.group(1);
      int end = m + 1 < marks.size() ? marks.get(m + 1) : range[1] + 1;
      List<String> observationLines = List.of(lines).subList(start, end);

      if (style.mergesByDate()) {
        List<String> outOfRange = labResults ? outOfRangeLines(observationLines) : List.of();
        merged
            .computeIfAbsent(date, d -> new MergedDay(pageAt[start]))
            .add(observationLines.size(), outOfRange);
        continue;
      }
      String display = style.format(date, observationLines, observationLines.size());
      if (!display.isEmpty()) {
        observations.add(new CategoryObservation(date, display, pageAt[start], List.of()));
      }
    }

    merged.forEach(
        (date, day) ->
            observations.add(
                new CategoryObservation(
                    date, style.format(date, List.of(), day.lineCount), day.page, day.outOfRange)));

    if (style == ObservationStyle.ALLERGIES && marks.isEmpty() && range[1] > range[0]) {
      List<String> allLines = List.of(lines).subList(range[0], range[1] + 1);
      String display = style.format("", allLines, allLines.size());
      if (!display.isEmpty()) {
        observations.add(new CategoryObservation("", display, pageAt[range[0]], List.of()));
      }
    }
    return observations;
  }

  private static List<String> outOfRangeLines(List<String> observationLines) {
    return observationLines.stream()
        .filter(l -> l.contains("OUT") && l.contains("OF") && l.contains("RANG"))
        .map(String::trim)
        .toList();
  }

  static String render(String category, List<CategoryObservation> observations) {
    StringBuilder markdown = new StringBuilder();
    markdown.append("# ").append(category).append('\n');
    markdown.append("**Total Observations:** ").append(observations.size()).append('\n');
    for (int i = 0; i < observations.size(); i++) {
      CategoryObservation observation = observations.get(i);
      if (i > 0) {
        markdown.append("\n---\n");
      }
      if (!observation.date().isEmpty()) {
        markdown.append("**Date:** ").append(observation.date()).append(" | ");
      }
      markdown.append("**Page:** ").append(observation.page()).append('\n');
      markdown.append(observation.display());
      if (!observation.outOfRangeLines().isEmpty()) {
        markdown
            .append(" | **Out of Range:** ")
            .append(String.join("; ", observation.outOfRangeLines()));
      }
    }
    return markdown.toString();
  }

  private static final class MergedDay {
    private final int page;
    private int lineCount;
    private final List<String> outOfRange = new ArrayList<>();

    private MergedDay(int page) {
      this.page = page;
    }

    private void add(int lines, List<String> outOfRangeLines) {
      lineCount += lines;
      outOfRange.addAll(outOfRangeLines);
    }
  }
}
