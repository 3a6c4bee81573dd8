package com.flamingo.ai.cliniclists.service.segmentation;

import com.flamingo.ai.cliniclists.service.segmentation.model.SectionSpan;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds every occurrence of a topical heading (e.g. {@code ### Medication Records}) in the full
 * document text and computes the span of text each one introduces.
 *
 * <p>A span starts right after its heading line and ends at the next heading found by any of the
 * requested labels. The last span ends at the next top-level ({@code #} or {@code ##}) heading, or
 * at the end of the document.
 */
@Component
@Slf4j
public class SectionLocator {

  /** Matches closer than this many characters are treated as the same physical heading. */
  static final int DUPLICATE_MATCH_DISTANCE = 10;

  private static final Pattern TOP_LEVEL_HEADING = Pattern.compile("\n#{1,2}\\s+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Locates all sections introduced by any of the given heading labels.
   *
   * @param fullText the full document text
   * @param headingLabels labels such as "Medication Record"; each also matches its plural
   * @return non-overlapping spans in document order; empty when no heading is present
   */
  public List<SectionSpan> locate(String fullText, List<String> headingLabels) {
    if (fullText == null || fullText.isEmpty() || headingLabels.isEmpty()) {
      return List.of();
    }

    List<HeadingMatch> matches = new ArrayList<>();
    for (String label : headingLabels) {
      Matcher matcher = headingPattern(label).matcher(fullText);
      while (matcher.find()) {
        int offset = matcher.start();
        boolean alreadyFound =
            matches.stream()
                .anyMatch(m -> Math.abs(m.offset() - offset) < DUPLICATE_MATCH_DISTANCE);
        if (!alreadyFound) {
          matches.add(new HeadingMatch(offset, bodyStart(fullText, matcher.end())));
        }
      }
    }

    if (matches.isEmpty()) {
      log.debug("No section found for headings {}", headingLabels);
      return List.of();
    }
    matches.sort(Comparator.comparingInt(HeadingMatch::offset));

    List<SectionSpan> spans = new ArrayList<>(matches.size());
    for (int i = 0; i < matches.size(); i++) {
      HeadingMatch current = matches.get(i);
      int end =
          i < matches.size() - 1
              ? matches.get(i + 1).offset()
              : nextTopLevelHeading(fullText, current.bodyStart());
      spans.add(
          new SectionSpan(
              current.offset(), current.bodyStart(), Math.max(end, current.bodyStart())));
    }

    log.debug("Located {} section(s) for headings {}", spans.size(), headingLabels);
    return spans;
  }

  static Pattern headingPattern(String label) {
    String words =
        Arrays.stream(WHITESPACE.split(label.trim()))
            .map(Pattern::quote)
            .collect(Collectors.joining("\\s+"));
    return Pattern.compile(
        "^#{1,3}[ \\t]*" + words + "s?[ \\t]*$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
  }

  private static int bodyStart(String fullText, int headingLineEnd) {
    if (headingLineEnd < fullText.length() && fullText.charAt(headingLineEnd) == '\n') {
      return headingLineEnd + 1;
    }
    return headingLineEnd;
  }

  private static int nextTopLevelHeading(String fullText, int from) {
    Matcher matcher = TOP_LEVEL_HEADING.matcher(fullText);
    return matcher.find(from) ? matcher.start() : fullText.length();
  }

  private record HeadingMatch(int offset, int bodyStart) {}
}
