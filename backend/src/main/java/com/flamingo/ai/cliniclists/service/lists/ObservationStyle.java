package com.flamingo.ai.cliniclists.service.lists;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** How observations of a category are rendered, chosen from keywords in the category name. */
enum ObservationStyle {
  ALLERGIES,
  MEDICATIONS,
  CLINICAL_NOTES,
  NEXT_LINE,
  LINE_COUNT,
  DATE_ONLY;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TYPE_PREFIX =
      Pattern.compile("^Type:\\s*", Pattern.CASE_INSENSITIVE);
  private static final Pattern AUTHOR_PREFIX =
      Pattern.compile("^Author:\\s*", Pattern.CASE_INSENSITIVE);

  static ObservationStyle of(String categoryName) {
    String lower = categoryName.toLowerCase(Locale.ROOT);
    if (lower.contains("allerg")) {
      return ALLERGIES;
    }
    if (lower.contains("medication")) {
      return MEDICATIONS;
    }
    if (lower.contains("clinical notes")) {
      return CLINICAL_NOTES;
    }
    if (lower.contains("procedure")
        || lower.contains("condition")
        || lower.contains("immunization")) {
      return NEXT_LINE;
    }
    if (lower.contains("clinical vitals") || lower.contains("lab result")) {
      return LINE_COUNT;
    }
    return DATE_ONLY;
  }

  boolean mergesByDate() {
    return this == LINE_COUNT;
  }

  /**
   * Renders one observation.
   *
   * @param date observation date, may be empty
   * @param lines observation lines; for dated observations the first one is the date line
   * @param lineCount merged line count, only used by {@link #LINE_COUNT}
   */
  String format(String date, List<String> lines, int lineCount) {
    switch (this) {
      case ALLERGIES:
        return formatAllergies(date, lines);
      case MEDICATIONS:
        if (lines.size() > 1) {
          String next = lines.get(1).trim();
          String[] parts = WHITESPACE.split(next);
          if (parts.length >= 2) {
            String dose = String.join(" ", List.of(parts).subList(1, parts.length));
            return date + " **" + parts[0] + "** **" + dose + "**";
          }
          return date + " **" + next + "**";
        }
        return date;
      case CLINICAL_NOTES:
        if (lines.size() >= 3) {
          String typeLine = lines.get(1).trim();
          String authorLine = lines.get(2).trim();
          String type = orFallback(TYPE_PREFIX.matcher(typeLine).replaceFirst("").trim(), typeLine);
          String author =
              orFallback(AUTHOR_PREFIX.matcher(authorLine).replaceFirst("").trim(), authorLine);
          return date
              + " **"
              + orFallback(type, "N/A")
              + "** by **"
              + orFallback(author, "N/A")
              + "**";
        }
        if (lines.size() == 2) {
          return date + " **" + orFallback(lines.get(1).trim(), "N/A") + "** by **N/A**";
        }
        return date;
      case NEXT_LINE:
        if (lines.size() > 1) {
          String next = lines.get(1).trim();
          if (next.startsWith("## ")) {
            next = next.substring(3).trim();
          }
          return date + " **" + next + "**";
        }
        return date;
      case LINE_COUNT:
        return date + " (" + lineCount + (lineCount == 1 ? " line)" : " lines)");
      default:
        return date;
    }
  }

  private static String formatAllergies(String date, List<String> lines) {
    List<String> entries = new ArrayList<>();
    int first = date.isEmpty() ? 0 : 1;
    for (String line : lines.subList(Math.min(first, lines.size()), lines.size())) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("###") || trimmed.startsWith("## ")) {
        continue;
      }
      char firstChar = trimmed.charAt(0);
      if (!Character.isLetter(firstChar) || !Character.isUpperCase(firstChar)) {
        continue;
      }
      int space = trimmed.indexOf(' ');
      entries.add(
          space > 0
              ? "**" + trimmed.substring(0, space) + "** " + trimmed.substring(space + 1)
              : "**" + trimmed + "**");
    }
    if (entries.isEmpty()) {
      return date;
    }
    String joined = String.join(" ", entries);
    return date.isEmpty() ? joined : date + " " + joined;
  }

  private static String orFallback(String value, String fallback) {
    return value.isEmpty() ? fallback : value;
  }
}
