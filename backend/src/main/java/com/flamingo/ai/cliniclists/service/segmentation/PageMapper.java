package com.flamingo.ai.cliniclists.service.segmentation;

import com.flamingo.ai.cliniclists.config.ListsConfig;
import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.service.segmentation.model.PageBlock;
import com.flamingo.ai.cliniclists.service.segmentation.model.SectionSpan;
import java.util.List;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps text offsets and records back to the page they came from.
 *
 * <p>Records are produced from filtered text whose offsets no longer line up with the full
 * document, so a record is relocated by searching for a prefix of its content (the anchor) inside
 * the located sections. The first occurrence wins. Short or repeated anchors can therefore land on
 * the wrong page; the mapping is best effort and defaults to page 1.
 */
@Component
@Slf4j
public class PageMapper {

  static final int DEFAULT_PAGE = 1;

  private final int anchorLength;

  public PageMapper(ListsConfig listsConfig) {
    this.anchorLength = listsConfig.getSegmentation().getAnchorLength();
  }

  /**
   * Finds the page whose rendered range {@code [accumulated, accumulated + length)} holds the
   * offset.
   */
  public OptionalInt pageForOffset(List<PageBlock> blocks, int offset) {
    if (offset < 0) {
      return OptionalInt.empty();
    }
    long accumulated = 0;
    for (PageBlock block : blocks) {
      if (offset < accumulated + block.renderedLength()) {
        return OptionalInt.of(block.pageNumber());
      }
      accumulated += block.renderedLength();
    }
    return OptionalInt.empty();
  }

  /** Like {@link #pageForOffset} but an offset past the last block maps to the last page. */
  public int pageForOffsetOrLast(List<PageBlock> blocks, int offset) {
    OptionalInt page = pageForOffset(blocks, offset);
    if (page.isPresent()) {
      return page.getAsInt();
    }
    if (!blocks.isEmpty() && offset >= 0) {
      return blocks.get(blocks.size() - 1).pageNumber();
    }
    return DEFAULT_PAGE;
  }

  /**
   * Assigns a page number to every record by relocating its anchor in the section spans.
   *
   * @return copies of the records with {@code page} set, in the same order
   */
  public List<ClinicalRecord> assignPages(
      List<ClinicalRecord> records,
      String fullText,
      List<SectionSpan> spans,
      List<PageBlock> blocks) {
    return records.stream()
        .map(record -> record.toBuilder().page(locatePage(record, fullText, spans, blocks)).build())
        .toList();
  }

  int locatePage(
      ClinicalRecord record, String fullText, List<SectionSpan> spans, List<PageBlock> blocks) {
    String anchor = anchorOf(record.getRawContent());
    if (anchor.isEmpty()) {
      return DEFAULT_PAGE;
    }
    for (SectionSpan span : spans) {
      int index = span.slice(fullText).indexOf(anchor);
      if (index >= 0) {
        return pageForOffset(blocks, span.start() + index).orElse(DEFAULT_PAGE);
      }
    }
    log.debug("Anchor of record {} not found in any section", record.getId());
    return DEFAULT_PAGE;
  }

  private String anchorOf(String content) {
    if (content == null) {
      return "";
    }
    return content.length() > anchorLength ? content.substring(0, anchorLength) : content;
  }
}
