package com.flamingo.ai.cliniclists.service.document;

import com.flamingo.ai.cliniclists.service.category.MarkdownCategory;
import com.flamingo.ai.cliniclists.service.lists.ObservationFile;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A processed source document as stored in its results file.
 *
 * <p>{@code pdfProcessedAt} is the timestamp list artifacts are checked against. The key fields are
 * {@code null} when the corresponding write failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceDocument {

  private String fileName;
  private int totalPages;
  @Builder.Default private List<DocumentPage> pages = new ArrayList<>();
  @Builder.Default private List<MarkdownCategory> categories = new ArrayList<>();
  private String categoryError;
  @Builder.Default private List<ObservationFile> observationFiles = new ArrayList<>();
  private String fullMarkdown;
  private Instant processedAt;
  private Instant pdfProcessedAt;
  private String pdfKey;
  private String resultsKey;
}
