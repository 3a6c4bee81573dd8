package com.flamingo.ai.cliniclists.service.segmentation;

import java.util.regex.Pattern;

/** Markdown helpers shared by the segmenters. */
final class MarkdownText {

  private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+", Pattern.MULTILINE);
  private static final Pattern BOLD = Pattern.compile("\\*\\*(.+?)\\*\\*");
  private static final Pattern ITALIC = Pattern.compile("\\*(.+?)\\*");
  private static final Pattern LINK = Pattern.compile("\\[(.+?)]\\(.+?\\)");
  private static final Pattern CODE = Pattern.compile("`(.+?)`");

  private MarkdownText() {}

  /** Strips headings, emphasis, links and inline code, keeping their text. */
  static String toPlainText(String markdown) {
    String text = HEADING.matcher(markdown).replaceAll("");
    text = BOLD.matcher(text).replaceAll("$1");
    text = ITALIC.matcher(text).replaceAll("$1");
    text = LINK.matcher(text).replaceAll("$1");
    text = CODE.matcher(text).replaceAll("$1");
    return text.trim();
  }
}
