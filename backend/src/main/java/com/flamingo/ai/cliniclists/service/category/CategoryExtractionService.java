package com.flamingo.ai.cliniclists.service.category;

import com.flamingo.ai.cliniclists.agent.CategoryExtractionAgent;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Lists a document's top-level categories through the text-generation model.
 *
 * <p>Never throws for model problems: a failed or timed-out call, an empty reply, or a reply with
 * nothing parseable comes back as a result with {@code categoryError} set and no categories.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryExtractionService {

  private final CategoryExtractionAgent categoryExtractionAgent;
  private final MarkdownCategoryParser parser;
  private final MeterRegistry meterRegistry;

  @Timed(value = "categories.extraction", description = "Time to list document categories")
  public CategoryExtractionResult extractCategories(String fileName, String fullMarkdown) {
    if (fullMarkdown == null || fullMarkdown.isBlank()) {
      log.warn("Cannot extract categories from '{}': empty content", fileName);
      return fail("Document has no content");
    }

    String reply;
    try {
      reply = categoryExtractionAgent.listCategories(fullMarkdown);
    } catch (Exception e) {
      log.warn("Category extraction failed for '{}': {}", fileName, e.getMessage());
      return fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    if (reply == null || reply.isBlank()) {
      log.warn("Category extraction returned an empty reply for '{}'", fileName);
      return fail("Empty response from text-generation model");
    }

    List<MarkdownCategory> categories = parser.parse(reply);
    if (categories.isEmpty()) {
      log.warn("No categories could be parsed from the reply for '{}'", fileName);
      return fail("No categories found in response");
    }

    log.info("Extracted {} markdown categories from '{}'", categories.size(), fileName);
    return CategoryExtractionResult.success(categories);
  }

  private CategoryExtractionResult fail(String reason) {
    meterRegistry.counter("categories.extraction.failure").increment();
    return CategoryExtractionResult.failure(reason);
  }
}
