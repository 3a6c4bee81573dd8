package com.flamingo.ai.cliniclists.service.segmentation;

import com.flamingo.ai.cliniclists.config.ListsConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Removes repeated headers and footers from one section's text.
 *
 * <p>Two passes: count every normalized non-blank line, then drop lines that match a known
 * boilerplate pattern or repeat more often than the configured threshold. Blank lines are kept so
 * the section's structure survives. The filter is stateless, so sections can be cleaned
 * independently, and applying it to its own output removes nothing further.
 */
@Component
@Slf4j
public class BoilerplateFilter {

  private static final List<Pattern> FIXED_PATTERNS =
      List.of(
          Pattern.compile("^Page\\s+\\d+", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\d+\\s*$"),
          Pattern.compile("^\\d{4}-\\d{2}-\\d{2}"),
          Pattern.compile("^Generated\\s+on", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^Exported\\s+on", Pattern.CASE_INSENSITIVE));

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final List<Pattern> boilerplatePatterns;
  private final int frequencyThreshold;

  public BoilerplateFilter(ListsConfig listsConfig) {
    ListsConfig.Boilerplate config = listsConfig.getBoilerplate();
    List<Pattern> patterns = new ArrayList<>(FIXED_PATTERNS);
    for (String letterhead : config.getLetterheadPatterns()) {
      patterns.add(Pattern.compile("^" + wordsPattern(letterhead), Pattern.CASE_INSENSITIVE));
    }
    this.boilerplatePatterns = List.copyOf(patterns);
    this.frequencyThreshold = config.getFrequencyThreshold();
  }

  /**
   * Filters boilerplate lines out of a section.
   *
   * @param sectionText raw section text
   * @return the remaining lines joined with {@code \n}, in their original order
   */
  public String filter(String sectionText) {
    if (sectionText == null || sectionText.isEmpty()) {
      return "";
    }

    String[] lines = sectionText.split("\n", -1);
    Map<String, Integer> frequencies = countFrequencies(lines);

    List<String> kept = new ArrayList<>(lines.length);
    int removed = 0;
    for (String line : lines) {
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        kept.add(line);
        continue;
      }
      if (isKnownBoilerplate(trimmed) || frequencies.get(normalize(trimmed)) > frequencyThreshold) {
        removed++;
        continue;
      }
      kept.add(line);
    }

    if (removed > 0) {
      log.debug("Removed {} boilerplate line(s) from section of {} lines", removed, lines.length);
    }
    return String.join("\n", kept);
  }

  private Map<String, Integer> countFrequencies(String[] lines) {
    Map<String, Integer> frequencies = new HashMap<>();
    for (String line : lines) {
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        frequencies.merge(normalize(trimmed), 1, Integer::sum);
      }
    }
    return frequencies;
  }

  private boolean isKnownBoilerplate(String trimmedLine) {
    return boilerplatePatterns.stream().anyMatch(p -> p.matcher(trimmedLine).find());
  }

  private static String wordsPattern(String phrase) {
    return Arrays.stream(WHITESPACE.split(phrase.trim()))
        .map(Pattern::quote)
        .collect(Collectors.joining("\\s+"));
  }

  static String normalize(String trimmedLine) {
    return WHITESPACE.matcher(trimmedLine.toLowerCase(Locale.ROOT)).replaceAll(" ");
  }
}
