package com.flamingo.ai.cliniclists.service.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.cliniclists.config.ListsConfig;
import com.flamingo.ai.cliniclists.exception.SourceNotFoundException;
import com.flamingo.ai.cliniclists.exception.StorageException;
import com.flamingo.ai.cliniclists.service.category.CategoryExtractionResult;
import com.flamingo.ai.cliniclists.service.category.CategoryExtractionService;
import com.flamingo.ai.cliniclists.service.lists.CategoryObservationWriter;
import com.flamingo.ai.cliniclists.service.lists.ListsStorageLayout;
import com.flamingo.ai.cliniclists.storage.ObjectStore;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns decoded pages into a stored source document and reads stored documents back.
 *
 * <p>Only the assembly itself is required to succeed. Category extraction, observation files and
 * the storage writes are best effort: a failure is logged and reflected on the returned document.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceDocumentService {

  private final MarkdownAssembler markdownAssembler;
  private final CategoryExtractionService categoryExtractionService;
  private final CategoryObservationWriter observationWriter;
  private final ListsStorageLayout layout;
  private final ObjectStore objectStore;
  private final ObjectMapper objectMapper;
  private final ListsConfig listsConfig;
  private final Clock clock;

  /**
   * Ingests a decoded document.
   *
   * @param ownerId owner of the document
   * @param fileName original file name
   * @param pages decoded pages in page order
   * @param pdfBytes original file to keep a copy of, or {@code null}
   * @param extractCategories whether to list the document's categories through the model
   * @return the document as stored
   */
  @Timed(value = "source.ingest", description = "Time to assemble and store a source document")
  public SourceDocument ingest(
      String ownerId,
      String fileName,
      List<DocumentPage> pages,
      byte[] pdfBytes,
      boolean extractCategories) {
    AssembledMarkdown assembled = markdownAssembler.assemble(pages);
    Instant now = clock.instant();

    SourceDocument document =
        SourceDocument.builder()
            .fileName(fileName)
            .totalPages(pages.size())
            .pages(List.copyOf(pages))
            .fullMarkdown(assembled.fullMarkdown())
            .processedAt(now)
            .pdfProcessedAt(now)
            .build();

    if (extractCategories) {
      CategoryExtractionResult categories =
          categoryExtractionService.extractCategories(fileName, assembled.fullMarkdown());
      document.setCategories(categories.categories());
      document.setCategoryError(categories.categoryError());
    }

    if (listsConfig.getObservations().isEnabled()) {
      try {
        document.setObservationFiles(
            observationWriter.writeCategoryFiles(ownerId, assembled.fullMarkdown()));
      } catch (StorageException e) {
        log.warn("Failed to write category files for '{}': {}", fileName, e.getMessage());
      }
    }

    if (pdfBytes != null) {
      String pdfKey = layout.pdfKey(ownerId, fileName);
      try {
        objectStore.put(pdfKey, pdfBytes);
        document.setPdfKey(pdfKey);
      } catch (StorageException e) {
        log.warn("Failed to store source copy {}: {}", pdfKey, e.getMessage());
      }
    }

    String resultsKey = layout.resultsKey(ownerId, fileName);
    try {
      document.setResultsKey(resultsKey);
      objectStore.put(resultsKey, objectMapper.writeValueAsBytes(document));
    } catch (IOException | StorageException e) {
      document.setResultsKey(null);
      log.warn("Failed to store results {}: {}", resultsKey, e.getMessage());
    }

    log.info(
        "Ingested '{}' for owner {}: {} page(s), {} category(ies)",
        fileName,
        ownerId,
        pages.size(),
        document.getCategories().size());
    return document;
  }

  /**
   * Loads a stored source document.
   *
   * @throws SourceNotFoundException if the key is outside the owner's folder or nothing is stored
   */
  public SourceDocument load(String ownerId, String resultsKey) {
    if (!layout.isOwnedBy(ownerId, resultsKey)) {
      throw new SourceNotFoundException(ownerId, resultsKey);
    }
    byte[] content =
        objectStore
            .get(resultsKey)
            .orElseThrow(() -> new SourceNotFoundException(ownerId, resultsKey));
    try {
      return objectMapper.readValue(content, SourceDocument.class);
    } catch (IOException e) {
      throw new StorageException("Failed to parse source document", resultsKey, e);
    }
  }

  /** Rebuilds the page blocks of a stored document. */
  public AssembledMarkdown assemble(SourceDocument document) {
    return markdownAssembler.assemble(document.getPages());
  }
}
