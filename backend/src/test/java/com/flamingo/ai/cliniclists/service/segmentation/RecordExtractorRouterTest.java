package com.flamingo.ai.cliniclists.service.segmentation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.cliniclists.config.ListsConfig;
import com.flamingo.ai.cliniclists.domain.enums.RecordCategory;
import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.service.document.AssembledMarkdown;
import com.flamingo.ai.cliniclists.service.document.DocumentPage;
import com.flamingo.ai.cliniclists.service.document.MarkdownAssembler;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Runs the complete extraction pipeline on assembled multi-page documents. */
class RecordExtractorRouterTest {

  private RecordExtractorRouter router;
  private final MarkdownAssembler assembler = new MarkdownAssembler();

  @BeforeEach
  void setUp() {
    ListsConfig config = new ListsConfig();
    SectionLocator locator = new SectionLocator();
    BoilerplateFilter filter = new BoilerplateFilter(config);
    PageMapper pageMapper = new PageMapper(config);
    router =
        new RecordExtractorRouter(
            List.of(
                new MedicationRecordExtractor(
                    locator,
                    filter,
                    new MedicationRecordSegmenter(new LineClassifier(config), config),
                    pageMapper),
                new ClinicalNoteExtractor(
                    locator, filter, new ClinicalNoteSegmenter(pageMapper, config))));
  }

  @Test
  @DisplayName("should extract medications with the page they appear on")
  void shouldExtractMedications_withPages() {
    AssembledMarkdown doc =
        assembler.assemble(
            List.of(
                page(1, "### Allergies\nPenicillin"),
                page(2, "Summary of care"),
                page(
                    3,
                    "### Medication Records\nJan 15, 2023\nAspirin 81 mg daily\nTake with food")));

    List<ClinicalRecord> records =
        router.extract(RecordCategory.MEDICATIONS, doc.fullMarkdown(), doc.blocks(), "chart.pdf");

    assertThat(records).singleElement().satisfies(record -> {
      assertThat(record.getName()).isEqualTo("Aspirin");
      assertThat(record.getValue()).isEqualTo("81 mg daily");
      assertThat(record.getPage()).isEqualTo(3);
      assertThat(record.getId()).isEqualTo("chart.pdf-med-0-0");
    });
  }

  @Test
  @DisplayName("should number notes across sections on different pages")
  void shouldNumberNotesAcrossSections() {
    String note =
        "Created: %s at 9:00 AM\nFollow-up visit, patient reports feeling much better today.";
    AssembledMarkdown doc =
        assembler.assemble(
            List.of(
                page(1, "### Clinical Notes\nMar 1, 2024\n" + note.formatted("Mar 1, 2024")),
                page(2, "### Clinical Notes\nMar 9, 2024\n" + note.formatted("Mar 9, 2024"))));

    List<ClinicalRecord> notes =
        router.extract(
            RecordCategory.CLINICAL_NOTES, doc.fullMarkdown(), doc.blocks(), "chart.pdf");

    assertThat(notes)
        .extracting(ClinicalRecord::getId)
        .containsExactly("chart.pdf-note-1", "chart.pdf-note-2");
    assertThat(notes).extracting(ClinicalRecord::getPage).containsExactly(1, 2);
    assertThat(notes)
        .extracting(ClinicalRecord::getDate)
        .containsExactly("Mar 1, 2024", "Mar 9, 2024");
  }

  @Test
  @DisplayName("should return no records when the category heading is missing")
  void shouldReturnEmpty_whenNoSection() {
    AssembledMarkdown doc = assembler.assemble(List.of(page(1, "### Lab Results\nNormal")));

    assertThat(
            router.extract(
                RecordCategory.MEDICATIONS, doc.fullMarkdown(), doc.blocks(), "chart.pdf"))
        .isEmpty();
  }

  private static DocumentPage page(int number, String markdown) {
    return new DocumentPage(number, markdown, markdown);
  }
}
