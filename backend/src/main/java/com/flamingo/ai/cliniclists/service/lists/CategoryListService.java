package com.flamingo.ai.cliniclists.service.lists;

import com.flamingo.ai.cliniclists.domain.enums.RecordCategory;
import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.domain.model.IndexResult;
import com.flamingo.ai.cliniclists.domain.model.ListArtifact;
import com.flamingo.ai.cliniclists.exception.IndexOperationException;
import com.flamingo.ai.cliniclists.exception.IndexUnavailableException;
import com.flamingo.ai.cliniclists.exception.StorageException;
import com.flamingo.ai.cliniclists.exception.UnsupportedCategoryException;
import com.flamingo.ai.cliniclists.service.document.AssembledMarkdown;
import com.flamingo.ai.cliniclists.service.document.SourceDocument;
import com.flamingo.ai.cliniclists.service.document.SourceDocumentService;
import com.flamingo.ai.cliniclists.service.index.BulkIndexOutcome;
import com.flamingo.ai.cliniclists.service.index.ClinicalRecordIndex;
import com.flamingo.ai.cliniclists.service.index.RecordSearchCriteria;
import com.flamingo.ai.cliniclists.service.index.RecordSearchResult;
import com.flamingo.ai.cliniclists.service.segmentation.RecordExtractorRouter;
import com.flamingo.ai.cliniclists.storage.ObjectStore;
import com.google.common.util.concurrent.Striped;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Serves record lists per (owner, source file, category), recomputing them only when the source
 * document was processed again after the stored list was built.
 *
 * <p>Requests for the same key are serialized within this process. Index-backed categories replace
 * the file's previous records in the index on every recomputation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryListService {

  static final String NO_NOTES_ERROR =
      "No individual notes could be extracted from Clinical Notes section";

  private static final int LOCK_STRIPES = 64;

  private final SourceDocumentService sourceDocumentService;
  private final RecordExtractorRouter extractorRouter;
  private final ClinicalRecordIndex recordIndex;
  private final ListArtifactStore artifactStore;
  private final ListsStorageLayout layout;
  private final ObjectStore objectStore;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final Striped<Lock> keyLocks = Striped.lock(LOCK_STRIPES);

  /**
   * Returns the record list for a category of a stored source document.
   *
   * @param ownerId owner of the document
   * @param resultsKey key of the stored source document
   * @param categoryName category such as "Medication Records" or "Clinical Notes"
   * @throws UnsupportedCategoryException if the category cannot be processed
   * @throws com.flamingo.ai.cliniclists.exception.SourceNotFoundException if the source is missing
   * @throws IndexUnavailableException if the category needs the index and none is configured
   */
  @Timed(value = "lists.process_category", description = "Time to serve a category record list")
  public CategoryListResult processCategory(
      String ownerId, String resultsKey, String categoryName) {
    RecordCategory category =
        RecordCategory.fromName(categoryName)
            .orElseThrow(() -> new UnsupportedCategoryException(categoryName));
    SourceDocument source = sourceDocumentService.load(ownerId, resultsKey);
    // aliases of one category share a key
    String listKey = layout.listKey(ownerId, source.getFileName(), category.getDisplayName());

    Lock lock = keyLocks.get(listKey);
    lock.lock();
    try {
      Optional<ListArtifact> cached = artifactStore.read(listKey);
      if (cached.isPresent() && cached.get().isFreshFor(source.getPdfProcessedAt())) {
        meterRegistry.counter("lists.cache.hit").increment();
        log.info("Serving cached {} list for '{}'", category, source.getFileName());
        return toResult(cached.get(), true, null);
      }
      meterRegistry.counter("lists.cache.miss").increment();
      if (cached.isPresent()) {
        log.info("Cached {} list for '{}' is stale, recomputing", category, source.getFileName());
      }

      ListArtifact artifact = recompute(ownerId, source, category, categoryName);
      Optional<String> writeError = artifactStore.save(listKey, artifact);
      return toResult(artifact, false, writeError.orElse(null));
    } finally {
      lock.unlock();
    }
  }

  private ListArtifact recompute(
      String ownerId, SourceDocument source, RecordCategory category, String categoryName) {
    if (category.isIndexBacked() && !recordIndex.isAvailable()) {
      throw new IndexUnavailableException(category.getDisplayName() + " indexing not configured");
    }

    String fileName = source.getFileName();
    AssembledMarkdown assembled = sourceDocumentService.assemble(source);

    List<String> errors = new ArrayList<>();
    long deleted = 0;
    if (category.isIndexBacked()) {
      try {
        deleted = recordIndex.deleteByFile(ownerId, fileName);
      } catch (IndexOperationException e) {
        log.warn("Failed to delete previous records of '{}': {}", fileName, e.getMessage());
        errors.add("Failed to delete previous records: " + e.getMessage());
      }
    }

    List<ClinicalRecord> records =
        extractorRouter.extract(
            category, assembled.fullMarkdown(), assembled.blocks(), fileName);
    meterRegistry
        .counter("lists.records.extracted", "category", category.name())
        .increment(records.size());

    IndexResult indexResult;
    if (!category.isIndexBacked()) {
      indexResult = IndexResult.notIndexed(records.size());
    } else if (records.isEmpty()) {
      errors.add(NO_NOTES_ERROR);
      indexResult = new IndexResult(0, 0, errors, deleted);
    } else {
      BulkIndexOutcome outcome;
      try {
        outcome = recordIndex.bulkIndex(ownerId, records);
      } catch (IndexOperationException e) {
        log.warn("Failed to index records of '{}': {}", fileName, e.getMessage());
        outcome = BulkIndexOutcome.failed("Failed to index records: " + e.getMessage());
      }
      errors.addAll(outcome.errors());
      indexResult = new IndexResult(records.size(), outcome.indexed(), errors, deleted);
    }

    log.info(
        "Processed {} for '{}': {} record(s), {} indexed, {} deleted, {} error(s)",
        category,
        fileName,
        records.size(),
        indexResult.indexed(),
        deleted,
        indexResult.errors().size());

    return ListArtifact.builder()
        .categoryName(categoryName)
        .sourceFile(fileName)
        .records(new ArrayList<>(records))
        .indexResult(indexResult)
        .processedAt(clock.instant())
        .sourceProcessedAt(source.getPdfProcessedAt())
        .build();
  }

  /**
   * Deletes every stored object in the owner's lists folder except folder placeholders.
   *
   * @return number of objects deleted
   */
  @Timed(value = "lists.clear_cache", description = "Time to clear an owner's lists folder")
  public int clearCache(String ownerId) {
    String folder = layout.folder(ownerId);
    int deleted = 0;
    for (String key : objectStore.list(folder)) {
      if (layout.isPlaceholder(key)) {
        continue;
      }
      try {
        if (objectStore.delete(key)) {
          deleted++;
        }
      } catch (StorageException e) {
        log.warn("Failed to delete {} while clearing cache: {}", key, e.getMessage());
      }
    }
    log.info("Cleared {} object(s) from {}", deleted, folder);
    return deleted;
  }

  /**
   * Searches the owner's indexed records.
   *
   * @throws IndexUnavailableException if no index is configured
   */
  public RecordSearchResult searchRecords(String ownerId, RecordSearchCriteria criteria) {
    if (!recordIndex.isAvailable()) {
      throw new IndexUnavailableException("Record search not configured");
    }
    return recordIndex.query(ownerId, criteria);
  }

  private static CategoryListResult toResult(
      ListArtifact artifact, boolean fromCache, String cacheWriteError) {
    return new CategoryListResult(
        artifact.getCategoryName(),
        artifact.getSourceFile(),
        artifact.getRecords(),
        artifact.getIndexResult(),
        artifact.getProcessedAt(),
        fromCache,
        cacheWriteError);
  }
}
