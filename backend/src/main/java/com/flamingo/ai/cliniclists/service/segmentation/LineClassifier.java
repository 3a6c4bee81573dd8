package com.flamingo.ai.cliniclists.service.segmentation;

import com.flamingo.ai.cliniclists.config.ListsConfig;
import com.flamingo.ai.cliniclists.service.segmentation.model.ClassifiedLine;
import com.flamingo.ai.cliniclists.service.segmentation.model.LineTag;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Tags a single section line. Pure: the result depends only on the line and the configured length
 * limits, never on the lines around it.
 */
@Component
public class LineClassifier {

  static final List<Pattern> DATE_PATTERNS =
      List.of(
          Pattern.compile(
              "^(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\s+\\d{1,2},?\\s+\\d{4}",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}"),
          Pattern.compile("^\\d{4}[/-]\\d{1,2}[/-]\\d{1,2}"));

  static final Pattern LOCATION =
      Pattern.compile(
          "mass general|brigham|hospital|medical center|clinic|health center",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern PAGE_MARKER =
      Pattern.compile(
          "(?:^|\\s)(?:##\\s*)?Page\\s+\\d+"
              + "|Continued\\s+(?:on|from)\\s+Page\\s+\\d+"
              + "|Page\\s+\\d+\\s+of",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern HEADER_FOOTER =
      Pattern.compile(
          "Health\\s+Page|Date\\s+of\\s+Birth|Patient\\s+Name|Medical\\s+Record|Chart\\s+Number"
              + "|MRN|Account\\s+Number",
          Pattern.CASE_INSENSITIVE);

  // Administrative lines that never start a record
  private static final List<Pattern> NON_RECORD_PREFIXES =
      List.of(
          Pattern.compile("^Patient\\s+ID", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^Account", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^Chart", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^Record\\s+Date", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^Printed", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^Generated", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^Confidential", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^##\\s*Page", Pattern.CASE_INSENSITIVE),
          Pattern.compile("Continued\\s+(on|from)", Pattern.CASE_INSENSITIVE));

  private static final String DOSE =
      "\\d+\\.?\\d*"
          + "(?:\\s*mg|\\s*mcg|\\s*units?|\\s*ml|\\s*tablets?|\\s*IU|\\s*MEQ)?"
          + "(?:\\s+[a-z]+)?";

  private static final Pattern RECORD_WITH_VALUE =
      Pattern.compile("^(.+?)\\s+(" + DOSE + ")", Pattern.CASE_INSENSITIVE);

  private static final Pattern DOSE_ANYWHERE =
      Pattern.compile("(" + DOSE + ")", Pattern.CASE_INSENSITIVE);

  private static final Pattern RECORD_NAME_ONLY =
      Pattern.compile("^([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*)");

  private final int dateLineMaxLength;
  private final int minLineLength;
  private final int maxLineLength;

  public LineClassifier(ListsConfig listsConfig) {
    ListsConfig.Segmentation config = listsConfig.getSegmentation();
    this.dateLineMaxLength = config.getDateLineMaxLength();
    this.minLineLength = config.getMinLineLength();
    this.maxLineLength = config.getMaxLineLength();
  }

  public ClassifiedLine classify(String rawLine) {
    String line = rawLine == null ? "" : rawLine.trim();
    if (line.isEmpty()) {
      return ClassifiedLine.of(line, LineTag.BLANK);
    }
    if (line.length() < dateLineMaxLength && isDate(line)) {
      return ClassifiedLine.of(line, LineTag.DATE);
    }
    if (LOCATION.matcher(line).find()) {
      return ClassifiedLine.of(line, LineTag.LOCATION);
    }
    if (PAGE_MARKER.matcher(line).find()) {
      return ClassifiedLine.of(line, LineTag.PAGE_MARKER);
    }
    if (HEADER_FOOTER.matcher(line).find()) {
      return ClassifiedLine.of(line, LineTag.HEADER_FOOTER);
    }
    if (line.length() < minLineLength || line.length() > maxLineLength) {
      return ClassifiedLine.of(line, LineTag.OUT_OF_BOUNDS_LENGTH);
    }
    if (NON_RECORD_PREFIXES.stream().anyMatch(p -> p.matcher(line).find())) {
      return ClassifiedLine.of(line, LineTag.HEADER_FOOTER);
    }

    Matcher withValue = RECORD_WITH_VALUE.matcher(line);
    if (withValue.find()) {
      return new ClassifiedLine(
          line, LineTag.RECORD_WITH_VALUE, withValue.group(1).trim(), withValue.group(2).trim());
    }
    Matcher nameOnly = RECORD_NAME_ONLY.matcher(line);
    if (nameOnly.find()) {
      return new ClassifiedLine(line, LineTag.RECORD_NAME_ONLY, nameOnly.group(1).trim(), "");
    }
    return ClassifiedLine.of(line, LineTag.CONTINUATION);
  }

  /** Finds a dosage anywhere in the line, used to complete a record opened without one. */
  public Optional<String> findValue(String line) {
    Matcher matcher = DOSE_ANYWHERE.matcher(line);
    return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
  }

  static boolean isDate(String line) {
    return DATE_PATTERNS.stream().anyMatch(p -> p.matcher(line).find());
  }
}
