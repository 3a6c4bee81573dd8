package com.flamingo.ai.cliniclists.service.category;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses the free-text category listing returned by the text-generation model.
 *
 * <p>{@code Name: 12} and {@code Name - 12} give a count. Any other non-blank line is taken as a
 * bare category name with a count of 0, after leading {@code ###}, {@code *} and {@code -} markers
 * are removed.
 */
@Component
public class MarkdownCategoryParser {

  private static final Pattern NAME_AND_COUNT = Pattern.compile("^(.+?)[:\\-]\\s*(\\d+)$");
  private static final Pattern HEADING_MARKER = Pattern.compile("^###\\s*");
  private static final Pattern BULLET_MARKER = Pattern.compile("^\\*\\s*");
  private static final Pattern DASH_MARKER = Pattern.compile("^-\\s*");

  public List<MarkdownCategory> parse(String reply) {
    if (reply == null || reply.isBlank()) {
      return List.of();
    }

    List<MarkdownCategory> categories = new ArrayList<>();
    for (String line : reply.split("\n")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      Matcher matcher = NAME_AND_COUNT.matcher(trimmed);
      if (matcher.matches()) {
        String category = stripMarkers(matcher.group(1));
        if (!category.isEmpty()) {
          categories.add(new MarkdownCategory(category, parseCount(matcher.group(2))));
          continue;
        }
      }
      String category = stripMarkers(trimmed);
      if (!category.isEmpty()) {
        categories.add(new MarkdownCategory(category, 0));
      }
    }
    return categories;
  }

  private static String stripMarkers(String text) {
    String stripped = HEADING_MARKER.matcher(text.trim()).replaceFirst("");
    stripped = BULLET_MARKER.matcher(stripped).replaceFirst("");
    stripped = DASH_MARKER.matcher(stripped).replaceFirst("");
    return stripped.trim();
  }

  private static int parseCount(String digits) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      // out of int range, treated as no count
      return 0;
    }
  }
}
