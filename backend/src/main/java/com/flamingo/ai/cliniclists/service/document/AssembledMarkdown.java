package com.flamingo.ai.cliniclists.service.document;

import com.flamingo.ai.cliniclists.service.segmentation.model.PageBlock;
import java.util.List;

/**
 * Full document markdown with the page blocks it was built from.
 *
 * @param fullMarkdown concatenated pages
 * @param blocks one block per page, in page order; lengths add up to {@code fullMarkdown.length()}
 */
public record AssembledMarkdown(String fullMarkdown, List<PageBlock> blocks) {

  public AssembledMarkdown {
    blocks = List.copyOf(blocks);
  }
}
