package com.flamingo.ai.cliniclists.service.document;

import com.flamingo.ai.cliniclists.service.segmentation.model.PageBlock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Joins pages into one markdown document. Each page is rendered as {@code ## Page N}, a blank line
 * and its markdown; pages are separated by a horizontal rule.
 */
@Component
public class MarkdownAssembler {

  static final String PAGE_SEPARATOR = "\n\n---\n\n";

  public AssembledMarkdown assemble(List<DocumentPage> pages) {
    StringBuilder fullMarkdown = new StringBuilder();
    List<PageBlock> blocks = new ArrayList<>(pages.size());
    for (int i = 0; i < pages.size(); i++) {
      DocumentPage page = pages.get(i);
      int before = fullMarkdown.length();
      fullMarkdown.append(pageHeader(page.pageNumber())).append(page.markdown());
      if (i < pages.size() - 1) {
        fullMarkdown.append(PAGE_SEPARATOR);
      }
      blocks.add(new PageBlock(page.pageNumber(), fullMarkdown.length() - before));
    }
    return new AssembledMarkdown(fullMarkdown.toString(), blocks);
  }

  static String pageHeader(int pageNumber) {
    return "## Page " + pageNumber + "\n\n";
  }
}
