package com.flamingo.ai.cliniclists.service.document;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.cliniclists.service.segmentation.model.PageBlock;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MarkdownAssemblerTest {

  private final MarkdownAssembler assembler = new MarkdownAssembler();

  @Test
  @DisplayName("should join pages with headers and separators but none after the last page")
  void shouldAssemblePages() {
    AssembledMarkdown result =
        assembler.assemble(
            List.of(new DocumentPage(1, "a", "First"), new DocumentPage(2, "b", "Second")));

    assertThat(result.fullMarkdown())
        .isEqualTo("## Page 1\n\nFirst\n\n---\n\n## Page 2\n\nSecond");
  }

  @Test
  @DisplayName("should record block lengths that add up to the document length")
  void shouldComputeBlocks() {
    AssembledMarkdown result =
        assembler.assemble(
            List.of(
                new DocumentPage(1, "", "First"),
                new DocumentPage(2, "", "Second"),
                new DocumentPage(3, "", "Third")));

    assertThat(result.blocks()).extracting(PageBlock::pageNumber).containsExactly(1, 2, 3);
    assertThat(result.blocks().get(0).renderedLength())
        .isEqualTo("## Page 1\n\nFirst\n\n---\n\n".length());
    assertThat(result.blocks().get(2).renderedLength()).isEqualTo("## Page 3\n\nThird".length());
    assertThat(result.blocks().stream().mapToInt(PageBlock::renderedLength).sum())
        .isEqualTo(result.fullMarkdown().length());
  }

  @Test
  @DisplayName("should produce an empty document for no pages")
  void shouldReturnEmpty_whenNoPages() {
    AssembledMarkdown result = assembler.assemble(List.of());

    assertThat(result.fullMarkdown()).isEmpty();
    assertThat(result.blocks()).isEmpty();
  }
}
