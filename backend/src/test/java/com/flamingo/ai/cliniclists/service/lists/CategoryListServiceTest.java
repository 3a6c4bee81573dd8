package com.flamingo.ai.cliniclists.service.lists;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flamingo.ai.cliniclists.config.ListsConfig;
import com.flamingo.ai.cliniclists.domain.enums.RecordCategory;
import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.exception.IndexOperationException;
import com.flamingo.ai.cliniclists.exception.IndexUnavailableException;
import com.flamingo.ai.cliniclists.exception.SourceNotFoundException;
import com.flamingo.ai.cliniclists.exception.UnsupportedCategoryException;
import com.flamingo.ai.cliniclists.service.document.AssembledMarkdown;
import com.flamingo.ai.cliniclists.service.document.SourceDocument;
import com.flamingo.ai.cliniclists.service.document.SourceDocumentService;
import com.flamingo.ai.cliniclists.service.index.BulkIndexOutcome;
import com.flamingo.ai.cliniclists.service.index.ClinicalRecordIndex;
import com.flamingo.ai.cliniclists.service.index.RecordSearchCriteria;
import com.flamingo.ai.cliniclists.service.index.RecordSearchResult;
import com.flamingo.ai.cliniclists.service.segmentation.RecordExtractorRouter;
import com.flamingo.ai.cliniclists.service.segmentation.model.PageBlock;
import com.flamingo.ai.cliniclists.storage.FileSystemObjectStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CategoryListServiceTest {

  private static final String OWNER = "owner-1";
  private static final String RESULTS_KEY = "owner-1/Lists/chart_results.json";
  private static final Instant T1 = Instant.parse("2025-03-01T10:00:00Z");
  private static final Instant T2 = Instant.parse("2025-03-02T10:00:00Z");
  private static final List<PageBlock> BLOCKS = List.of(new PageBlock(1, 40));
  private static final AssembledMarkdown ASSEMBLED = new AssembledMarkdown("## Page 1\n\n", BLOCKS);

  @Mock private SourceDocumentService sourceDocumentService;
  @Mock private RecordExtractorRouter extractorRouter;
  @Mock private ClinicalRecordIndex recordIndex;

  @TempDir Path tempDir;

  private FileSystemObjectStore objectStore;
  private SimpleMeterRegistry meterRegistry;
  private CategoryListService service;

  @BeforeEach
  void setUp() {
    objectStore = new FileSystemObjectStore(tempDir);
    meterRegistry = new SimpleMeterRegistry();
    ObjectMapper objectMapper =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    service =
        new CategoryListService(
            sourceDocumentService,
            extractorRouter,
            recordIndex,
            new ListArtifactStore(objectStore, objectMapper, meterRegistry),
            new ListsStorageLayout(new ListsConfig()),
            objectStore,
            meterRegistry,
            Clock.fixed(T2.plusSeconds(60), ZoneOffset.UTC));
  }

  @Test
  @DisplayName("should serve a stored list until the source is processed again")
  void shouldRecomputeOnlyWhenSourceIsNewer() {
    SourceDocument original = source(T1);
    when(sourceDocumentService.load(OWNER, RESULTS_KEY)).thenReturn(original);
    when(sourceDocumentService.assemble(any())).thenReturn(ASSEMBLED);
    when(extractorRouter.extract(
            eq(RecordCategory.MEDICATIONS), anyString(), anyList(), eq("chart.pdf")))
        .thenReturn(List.of(medication("Aspirin")));

    CategoryListResult first = service.processCategory(OWNER, RESULTS_KEY, "Medication Records");
    CategoryListResult second = service.processCategory(OWNER, RESULTS_KEY, "Medication Records");

    assertThat(first.fromCache()).isFalse();
    assertThat(first.cacheWriteError()).isNull();
    assertThat(second.fromCache()).isTrue();
    assertThat(second.records()).extracting(ClinicalRecord::getName).containsExactly("Aspirin");
    assertThat(second.indexResult().total()).isEqualTo(1);
    verify(extractorRouter, times(1)).extract(any(), anyString(), anyList(), anyString());

    when(sourceDocumentService.load(OWNER, RESULTS_KEY)).thenReturn(source(T2));
    CategoryListResult third = service.processCategory(OWNER, RESULTS_KEY, "Medication Records");

    assertThat(third.fromCache()).isFalse();
    verify(extractorRouter, times(2)).extract(any(), anyString(), anyList(), anyString());
    assertThat(meterRegistry.counter("lists.cache.hit").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("lists.cache.miss").count()).isEqualTo(2.0);
    verify(recordIndex, never()).bulkIndex(anyString(), anyList());
  }

  @Test
  @DisplayName("should store the list artifact with the source timestamp")
  void shouldWriteArtifact_whenRecomputed() {
    when(sourceDocumentService.load(OWNER, RESULTS_KEY)).thenReturn(source(T1));
    when(sourceDocumentService.assemble(any())).thenReturn(ASSEMBLED);
    when(extractorRouter.extract(any(), anyString(), anyList(), anyString()))
        .thenReturn(List.of(medication("Aspirin")));

    service.processCategory(OWNER, RESULTS_KEY, "Medications");

    String stored =
        new String(
            objectStore.get("owner-1/Lists/chart_medications_list.json").orElseThrow(),
            StandardCharsets.UTF_8);
    assertThat(stored).contains("\"sourceProcessedAt\":\"2025-03-01T10:00:00Z\"");
    assertThat(stored).contains("\"categoryName\":\"Medications\"");
  }

  @Test
  @DisplayName("should replace indexed notes by deleting before inserting")
  void shouldDeleteBeforeBulkIndex_whenClinicalNotes() {
    List<ClinicalRecord> notes = List.of(note(1), note(2));
    when(sourceDocumentService.load(OWNER, RESULTS_KEY)).thenReturn(source(T1));
    when(sourceDocumentService.assemble(any())).thenReturn(ASSEMBLED);
    when(recordIndex.isAvailable()).thenReturn(true);
    when(recordIndex.deleteByFile(OWNER, "chart.pdf")).thenReturn(3L);
    when(extractorRouter.extract(
            eq(RecordCategory.CLINICAL_NOTES), anyString(), anyList(), eq("chart.pdf")))
        .thenReturn(notes);
    when(recordIndex.bulkIndex(OWNER, notes)).thenReturn(new BulkIndexOutcome(2, List.of()));

    CategoryListResult result = service.processCategory(OWNER, RESULTS_KEY, "Clinical Notes");

    InOrder order = inOrder(recordIndex);
    order.verify(recordIndex).deleteByFile(OWNER, "chart.pdf");
    order.verify(recordIndex).bulkIndex(OWNER, notes);
    assertThat(result.indexResult().total()).isEqualTo(2);
    assertThat(result.indexResult().indexed()).isEqualTo(2);
    assertThat(result.indexResult().deleted()).isEqualTo(3L);
    assertThat(result.indexResult().errors()).isEmpty();
  }

  @Test
  @DisplayName("should keep the notes list and report errors when indexing fails")
  void shouldSaveArtifactWithErrors_whenBulkIndexFails() {
    List<ClinicalRecord> notes = List.of(note(1), note(2));
    when(sourceDocumentService.load(OWNER, RESULTS_KEY)).thenReturn(source(T1));
    when(sourceDocumentService.assemble(any())).thenReturn(ASSEMBLED);
    when(recordIndex.isAvailable()).thenReturn(true);
    when(recordIndex.deleteByFile(OWNER, "chart.pdf")).thenReturn(2L);
    when(extractorRouter.extract(any(), anyString(), anyList(), anyString())).thenReturn(notes);
    when(recordIndex.bulkIndex(OWNER, notes))
        .thenReturn(BulkIndexOutcome.failed("Indexing failed: es down"));

    CategoryListResult result = service.processCategory(OWNER, RESULTS_KEY, "Clinical Notes");

    assertThat(result.records()).hasSize(2);
    assertThat(result.indexResult().total()).isEqualTo(2);
    assertThat(result.indexResult().indexed()).isZero();
    assertThat(result.indexResult().deleted()).isEqualTo(2L);
    assertThat(result.indexResult().errors()).containsExactly("Indexing failed: es down");
    assertThat(result.cacheWriteError()).isNull();
    assertThat(objectStore.get("owner-1/Lists/chart_clinical_notes_list.json")).isPresent();
  }

  @Test
  @DisplayName("should absorb an index exception thrown while inserting notes")
  void shouldSaveArtifactWithErrors_whenBulkIndexThrows() {
    List<ClinicalRecord> notes = List.of(note(1));
    when(sourceDocumentService.load(OWNER, RESULTS_KEY)).thenReturn(source(T1));
    when(sourceDocumentService.assemble(any())).thenReturn(ASSEMBLED);
    when(recordIndex.isAvailable()).thenReturn(true);
    when(extractorRouter.extract(any(), anyString(), anyList(), anyString())).thenReturn(notes);
    when(recordIndex.bulkIndex(OWNER, notes))
        .thenThrow(new IndexOperationException("Failed to index documents", null));

    CategoryListResult result = service.processCategory(OWNER, RESULTS_KEY, "Clinical Notes");

    assertThat(result.records()).hasSize(1);
    assertThat(result.indexResult().indexed()).isZero();
    assertThat(result.indexResult().errors())
        .containsExactly("Failed to index records: Failed to index documents");
    assertThat(objectStore.get("owner-1/Lists/chart_clinical_notes_list.json")).isPresent();
  }

  @Test
  @DisplayName("should share one stored list between names of the same category")
  void shouldServeFromCache_whenCategoryAliasUsed() {
    when(sourceDocumentService.load(OWNER, RESULTS_KEY)).thenReturn(source(T1));
    when(sourceDocumentService.assemble(any())).thenReturn(ASSEMBLED);
    when(extractorRouter.extract(any(), anyString(), anyList(), anyString()))
        .thenReturn(List.of(medication("Aspirin")));

    service.processCategory(OWNER, RESULTS_KEY, "Medication Records");
    CategoryListResult second = service.processCategory(OWNER, RESULTS_KEY, "Medications");

    assertThat(second.fromCache()).isTrue();
    assertThat(objectStore.list("owner-1/Lists/"))
        .containsExactly("owner-1/Lists/chart_medications_list.json");
    verify(extractorRouter, times(1)).extract(any(), anyString(), anyList(), anyString());
  }

  @Test
  @DisplayName("should report an error when no notes could be extracted")
  void shouldReportError_whenNoNotesFound() {
    when(sourceDocumentService.load(OWNER, RESULTS_KEY)).thenReturn(source(T1));
    when(sourceDocumentService.assemble(any())).thenReturn(ASSEMBLED);
    when(recordIndex.isAvailable()).thenReturn(true);
    when(extractorRouter.extract(any(), anyString(), anyList(), anyString()))
        .thenReturn(List.of());

    CategoryListResult result = service.processCategory(OWNER, RESULTS_KEY, "Clinical Notes");

    assertThat(result.records()).isEmpty();
    assertThat(result.indexResult().errors()).containsExactly(CategoryListService.NO_NOTES_ERROR);
    verify(recordIndex, never()).bulkIndex(anyString(), anyList());
  }

  @Test
  @DisplayName("should fail index-backed categories when no index is configured")
  void shouldThrow_whenIndexUnavailable() {
    when(sourceDocumentService.load(OWNER, RESULTS_KEY)).thenReturn(source(T1));
    when(recordIndex.isAvailable()).thenReturn(false);

    assertThatThrownBy(() -> service.processCategory(OWNER, RESULTS_KEY, "Clinical Notes"))
        .isInstanceOf(IndexUnavailableException.class)
        .extracting(e -> ((IndexUnavailableException) e).getUserMessage())
        .isEqualTo("Clinical Notes indexing not configured");
    verify(extractorRouter, never()).extract(any(), anyString(), anyList(), anyString());
  }

  @Test
  @DisplayName("should still return records when the list cannot be stored")
  void shouldReturnRecords_whenCacheWriteFails() throws Exception {
    Files.createDirectories(tempDir.resolve("owner-1/Lists/chart_medications_list.json"));
    when(sourceDocumentService.load(OWNER, RESULTS_KEY)).thenReturn(source(T1));
    when(sourceDocumentService.assemble(any())).thenReturn(ASSEMBLED);
    when(extractorRouter.extract(any(), anyString(), anyList(), anyString()))
        .thenReturn(List.of(medication("Aspirin")));

    CategoryListResult result = service.processCategory(OWNER, RESULTS_KEY, "Medications");

    assertThat(result.records()).hasSize(1);
    assertThat(result.cacheWriteError()).startsWith("Failed to save list");
    assertThat(meterRegistry.counter("lists.cache.write.failure").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should propagate a missing source document")
  void shouldThrow_whenSourceMissing() {
    when(sourceDocumentService.load(OWNER, RESULTS_KEY))
        .thenThrow(new SourceNotFoundException(OWNER, RESULTS_KEY));

    assertThatThrownBy(() -> service.processCategory(OWNER, RESULTS_KEY, "Medications"))
        .isInstanceOf(SourceNotFoundException.class);
  }

  @Test
  @DisplayName("should reject categories without a record extractor")
  void shouldThrow_whenCategoryUnsupported() {
    assertThatThrownBy(() -> service.processCategory(OWNER, RESULTS_KEY, "Vitals"))
        .isInstanceOf(UnsupportedCategoryException.class);
    verify(sourceDocumentService, never()).load(anyString(), anyString());
  }

  @Test
  @DisplayName("should clear every stored object except placeholders")
  void shouldClearCache_exceptPlaceholders() {
    objectStore.put("owner-1/Lists/.keep", new byte[0]);
    objectStore.put("owner-1/Lists/chart_results.json", new byte[] {1});
    objectStore.put("owner-1/Lists/chart_medications_list.json", new byte[] {1});
    objectStore.put("owner-2/Lists/other_results.json", new byte[] {1});

    int deleted = service.clearCache(OWNER);

    assertThat(deleted).isEqualTo(2);
    assertThat(objectStore.list("owner-1/Lists/")).containsExactly("owner-1/Lists/.keep");
    assertThat(objectStore.get("owner-2/Lists/other_results.json")).isPresent();
  }

  @Test
  @DisplayName("should search through the index when it is available")
  void shouldDelegateSearch_whenIndexAvailable() {
    RecordSearchCriteria criteria = RecordSearchCriteria.builder().query("aspirin").build();
    RecordSearchResult expected = new RecordSearchResult(1, List.of(medication("Aspirin")));
    when(recordIndex.isAvailable()).thenReturn(true);
    when(recordIndex.query(OWNER, criteria)).thenReturn(expected);

    assertThat(service.searchRecords(OWNER, criteria)).isEqualTo(expected);
  }

  @Test
  @DisplayName("should report a failing index instead of returning no hits")
  void shouldPropagateSearchFailure_whenIndexFails() {
    RecordSearchCriteria criteria = RecordSearchCriteria.builder().query("aspirin").build();
    when(recordIndex.isAvailable()).thenReturn(true);
    when(recordIndex.query(OWNER, criteria))
        .thenThrow(new IndexOperationException("Search failed", null));

    assertThatThrownBy(() -> service.searchRecords(OWNER, criteria))
        .isInstanceOf(IndexOperationException.class)
        .hasMessage("Search failed");
  }

  @Test
  @DisplayName("should fail searches when no index is configured")
  void shouldThrowOnSearch_whenIndexUnavailable() {
    when(recordIndex.isAvailable()).thenReturn(false);

    assertThatThrownBy(
            () -> service.searchRecords(OWNER, RecordSearchCriteria.builder().build()))
        .isInstanceOf(IndexUnavailableException.class);
  }

  private static SourceDocument source(Instant pdfProcessedAt) {
    return SourceDocument.builder()
        .fileName("chart.pdf")
        .totalPages(1)
        .pdfProcessedAt(pdfProcessedAt)
        .processedAt(pdfProcessedAt)
        .resultsKey(RESULTS_KEY)
        .build();
  }

  private static ClinicalRecord medication(String name) {
    return ClinicalRecord.builder()
        .id("chart.pdf-med-0-0")
        .name(name)
        .value("81 mg")
        .date("Jan 1, 2024")
        .sourceFile("chart.pdf")
        .category("Medications")
        .rawContent(name + " 81 mg")
        .rawMarkdown(name + " 81 mg")
        .build();
  }

  private static ClinicalRecord note(int number) {
    return ClinicalRecord.builder()
        .id("chart.pdf-note-" + number)
        .name("Progress Note")
        .sourceFile("chart.pdf")
        .category("Clinical Notes")
        .rawContent("Body " + number)
        .rawMarkdown("Body " + number)
        .build();
  }
}
