package com.flamingo.ai.cliniclists.service.segmentation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.cliniclists.config.ListsConfig;
import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.service.segmentation.model.PageBlock;
import com.flamingo.ai.cliniclists.service.segmentation.model.SectionSpan;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PageMapperTest {

  private static final List<PageBlock> BLOCKS =
      List.of(new PageBlock(1, 100), new PageBlock(2, 100), new PageBlock(3, 50));

  private final PageMapper mapper = new PageMapper(new ListsConfig());

  @Test
  @DisplayName("should map offsets to the block holding them with half-open ranges")
  void shouldMapOffsetToPage() {
    assertThat(mapper.pageForOffset(BLOCKS, 0)).hasValue(1);
    assertThat(mapper.pageForOffset(BLOCKS, 99)).hasValue(1);
    assertThat(mapper.pageForOffset(BLOCKS, 100)).hasValue(2);
    assertThat(mapper.pageForOffset(BLOCKS, 249)).hasValue(3);
  }

  @Test
  @DisplayName("should report no page for offsets outside the document")
  void shouldReturnEmpty_whenOffsetOutOfRange() {
    assertThat(mapper.pageForOffset(BLOCKS, 250)).isEmpty();
    assertThat(mapper.pageForOffset(BLOCKS, -1)).isEmpty();
  }

  @Test
  @DisplayName("should fall back to the last page past the end")
  void shouldUseLastPage_whenPastEnd() {
    assertThat(mapper.pageForOffsetOrLast(BLOCKS, 1_000)).isEqualTo(3);
    assertThat(mapper.pageForOffsetOrLast(List.of(), 10)).isEqualTo(PageMapper.DEFAULT_PAGE);
  }

  @Test
  @DisplayName("should assign the page where the record content is found")
  void shouldAssignPage_whenAnchorFound() {
    String page1 = "## Page 1\n\n### Medications\nJan 1, 2023\n";
    String page2 = "## Page 2\n\nfiller\n";
    String page3 = "## Page 3\n\nAspirin 81 mg daily\n";
    String fullText = page1 + page2 + page3;
    List<PageBlock> blocks =
        List.of(
            new PageBlock(1, page1.length()),
            new PageBlock(2, page2.length()),
            new PageBlock(3, page3.length()));
    int bodyStart = fullText.indexOf("Jan 1");
    List<SectionSpan> spans = List.of(new SectionSpan(0, bodyStart, fullText.length()));
    ClinicalRecord record =
        ClinicalRecord.builder().id("r1").rawContent("Aspirin 81 mg daily").build();

    List<ClinicalRecord> paged = mapper.assignPages(List.of(record), fullText, spans, blocks);

    assertThat(paged).singleElement().extracting(ClinicalRecord::getPage).isEqualTo(3);
    assertThat(record.getPage()).isEqualTo(1);
  }

  @Test
  @DisplayName("should default to page one when the anchor is not found")
  void shouldDefaultPage_whenAnchorMissing() {
    ClinicalRecord record = ClinicalRecord.builder().id("r1").rawContent("Nowhere").build();
    SectionSpan span = new SectionSpan(0, 0, 5);

    assertThat(mapper.locatePage(record, "Other", List.of(span), BLOCKS))
        .isEqualTo(PageMapper.DEFAULT_PAGE);
  }
}
