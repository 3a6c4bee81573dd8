package com.flamingo.ai.cliniclists.elasticsearch;

import static com.google.common.base.Strings.nullToEmpty;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.cliniclists.domain.model.ClinicalRecord;
import com.flamingo.ai.cliniclists.exception.IndexOperationException;
import com.flamingo.ai.cliniclists.service.index.BulkIndexOutcome;
import com.flamingo.ai.cliniclists.service.index.ClinicalRecordIndex;
import com.flamingo.ai.cliniclists.service.index.RecordSearchCriteria;
import com.flamingo.ai.cliniclists.service.index.RecordSearchResult;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hashing;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for clinical records.
 *
 * <p>All owners share one index. Every search and delete carries a {@code term ownerId} filter, and
 * document ids are derived from owner and record id so owners cannot overwrite each other.
 */
@Service
@ConditionalOnProperty(name = "elasticsearch.enabled", havingValue = "true")
@Slf4j
public class ClinicalRecordIndexService
    extends AbstractElasticsearchIndexService<ClinicalRecordDocument>
    implements ClinicalRecordIndex {

  static final String OWNER_ID = "ownerId";
  static final String FILE_NAME = "fileName";
  static final String CATEGORY = "category";
  static final String PAGE = "page";

  @Value("${app.elasticsearch.index-name:clinical-records}")
  private String indexName;

  private final Clock clock;

  @Autowired
  public ClinicalRecordIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, Clock clock) {
    super(elasticsearchClient, meterRegistry);
    this.clock = clock;
  }

  /** Constructor for testing - allows setting the index name. */
  @VisibleForTesting
  ClinicalRecordIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      Clock clock,
      String indexName) {
    this(elasticsearchClient, meterRegistry, clock);
    this.indexName = indexName;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index clinical records")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "bulkIndexFallback")
  public BulkIndexOutcome bulkIndex(String ownerId, List<ClinicalRecord> records) {
    Instant now = clock.instant();
    List<ClinicalRecordDocument> documents = new ArrayList<>(records.size());
    for (ClinicalRecord record : records) {
      documents.add(toDocument(ownerId, record, now));
    }
    BulkIndexOutcome outcome = indexDocuments(documents);
    refresh();
    log.info(
        "Indexed {}/{} record(s) for owner {} ({} error(s))",
        outcome.indexed(),
        records.size(),
        ownerId,
        outcome.errors().size());
    return outcome;
  }

  @VisibleForTesting
  BulkIndexOutcome bulkIndexFallback(String ownerId, List<ClinicalRecord> records, Throwable t) {
    log.warn(
        "Indexing {} record(s) for owner {} failed: {}", records.size(), ownerId, t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".index.fallback").increment();
    return BulkIndexOutcome.failed("Indexing failed: " + t.getMessage());
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete a file's records")
  public long deleteByFile(String ownerId, String fileName) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(OWNER_ID, ownerId);
    criteria.put(FILE_NAME, fileName);
    long deleted = deleteBy(criteria);
    refresh();
    return deleted;
  }

  @Override
  @Timed(value = "elasticsearch.search", description = "Time for filtered record search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "queryFallback")
  public RecordSearchResult query(String ownerId, RecordSearchCriteria criteria) {
    Map<String, Object> filters = new HashMap<>();
    filters.put(OWNER_ID, ownerId);
    if (criteria.category() != null) {
      filters.put(CATEGORY, criteria.category());
    }
    if (criteria.fileName() != null) {
      filters.put(FILE_NAME, criteria.fileName());
    }
    if (criteria.page() != null) {
      filters.put(PAGE, criteria.page());
    }
    SearchPage<ClinicalRecordDocument> page =
        search(filters, criteria.query(), criteria.from(), criteria.size());
    return new RecordSearchResult(
        page.total(), page.hits().stream().map(ClinicalRecordIndexService::toRecord).toList());
  }

  /** A failed search is reported to the caller, never turned into an empty page. */
  @VisibleForTesting
  RecordSearchResult queryFallback(String ownerId, RecordSearchCriteria criteria, Throwable t) {
    log.warn("Record search for owner {} failed: {}", ownerId, t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".search.fallback").increment();
    if (t instanceof IndexOperationException e) {
      throw e;
    }
    throw new IndexOperationException("Search failed: " + t.getMessage(), t);
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // Filter fields MUST be keyword type for exact matching
    for (String keyword :
        List.of(OWNER_ID, FILE_NAME, CATEGORY, "date", "location", "recordId")) {
      properties.put(keyword, Property.of(p -> p.keyword(k -> k)));
    }
    properties.put(PAGE, Property.of(p -> p.integer(i -> i)));
    for (String text :
        List.of("content", "markdown", "name", "value", "type", "author", "created")) {
      properties.put(text, Property.of(p -> p.text(t -> t)));
    }
    properties.put("indexedAt", Property.of(p -> p.date(d -> d)));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(ClinicalRecordDocument document) {
    Map<String, Object> source = new HashMap<>();
    source.put(OWNER_ID, document.getOwnerId());
    source.put("recordId", document.getRecordId());
    source.put(FILE_NAME, document.getFileName());
    source.put("name", document.getName());
    source.put("value", document.getValue());
    source.put(CATEGORY, document.getCategory());
    source.put("date", document.getDate());
    source.put(PAGE, document.getPage());
    source.put("location", document.getLocation());
    source.put("type", document.getType());
    source.put("author", document.getAuthor());
    source.put("created", document.getCreated());
    source.put("content", document.getContent());
    source.put("markdown", document.getMarkdown());
    if (document.getIndexedAt() != null) {
      source.put("indexedAt", document.getIndexedAt().toString());
    }
    return source;
  }

  @Override
  protected ClinicalRecordDocument convertFromDocument(Map<String, Object> source) {
    Object page = source.get(PAGE);
    Object indexedAt = source.get("indexedAt");
    return ClinicalRecordDocument.builder()
        .id((String) source.get("id"))
        .ownerId((String) source.get(OWNER_ID))
        .recordId((String) source.get("recordId"))
        .fileName((String) source.get(FILE_NAME))
        .name((String) source.get("name"))
        .value((String) source.get("value"))
        .category((String) source.get(CATEGORY))
        .date((String) source.get("date"))
        .page(page instanceof Number n ? n.intValue() : 1)
        .location((String) source.get("location"))
        .type((String) source.get("type"))
        .author((String) source.get("author"))
        .created((String) source.get("created"))
        .content((String) source.get("content"))
        .markdown((String) source.get("markdown"))
        .indexedAt(indexedAt instanceof String s ? Instant.parse(s) : null)
        .build();
  }

  @Override
  protected String getDocumentId(ClinicalRecordDocument document) {
    return document.getId();
  }

  @Override
  protected SearchRequest buildSearchRequest(
      Map<String, Object> filterCriteria, String query, int from, int size) {
    BoolQuery.Builder bool = new BoolQuery.Builder().filter(ownerFilter(filterCriteria));
    for (String field : List.of(CATEGORY, FILE_NAME)) {
      Object value = filterCriteria.get(field);
      if (value != null) {
        bool.filter(f -> f.term(t -> t.field(field).value(value.toString())));
      }
    }
    Object page = filterCriteria.get(PAGE);
    if (page instanceof Number n) {
      bool.filter(f -> f.term(t -> t.field(PAGE).value(FieldValue.of(n.longValue()))));
    }
    if (query != null && !query.isBlank()) {
      bool.must(
          m ->
              m.multiMatch(
                  mm ->
                      mm.fields("name^2.0", "content", "markdown")
                          .query(query)
                          .type(TextQueryType.BestFields)));
    }

    Query boolQuery = Query.of(q -> q.bool(bool.build()));
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .query(boolQuery)
                .sort(o -> o.field(f -> f.field(FILE_NAME).order(SortOrder.Asc)))
                .sort(o -> o.field(f -> f.field(PAGE).order(SortOrder.Asc)))
                .from(from)
                .size(size));
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    Object fileName = criteria.get(FILE_NAME);
    if (fileName == null) {
      throw new IllegalArgumentException("deleteBy requires fileName in criteria");
    }
    return Query.of(
        q ->
            q.bool(
                b ->
                    b.filter(ownerFilter(criteria))
                        .filter(f -> f.term(t -> t.field(FILE_NAME).value(fileName.toString())))));
  }

  @Override
  protected String getMetricPrefix() {
    return "clinical_record";
  }

  private static Query ownerFilter(Map<String, Object> criteria) {
    Object ownerId = criteria.get(OWNER_ID);
    if (ownerId == null) {
      throw new IllegalArgumentException("ownerId filter is required");
    }
    return Query.of(q -> q.term(t -> t.field(OWNER_ID).value(ownerId.toString())));
  }

  @VisibleForTesting
  static String documentId(String ownerId, String recordId) {
    return Hashing.sha256().hashString(ownerId + "|" + recordId, StandardCharsets.UTF_8).toString();
  }

  private static ClinicalRecordDocument toDocument(
      String ownerId, ClinicalRecord record, Instant indexedAt) {
    return ClinicalRecordDocument.builder()
        .id(documentId(ownerId, record.getId()))
        .ownerId(ownerId)
        .recordId(record.getId())
        .fileName(record.getSourceFile())
        .name(record.getName())
        .value(record.getValue())
        .category(record.getCategory())
        .date(record.getDate())
        .page(record.getPage())
        .location(record.getLocation())
        .type(record.getNoteType())
        .author(record.getAuthor())
        .created(record.getCreated())
        .content(record.getRawContent())
        .markdown(record.getRawMarkdown())
        .indexedAt(indexedAt)
        .build();
  }

  private static ClinicalRecord toRecord(ClinicalRecordDocument document) {
    return ClinicalRecord.builder()
        .id(document.getRecordId())
        .name(document.getName())
        .value(nullToEmpty(document.getValue()))
        .date(nullToEmpty(document.getDate()))
        .sourceFile(document.getFileName())
        .page(document.getPage())
        .category(document.getCategory())
        .rawContent(document.getContent())
        .rawMarkdown(document.getMarkdown())
        .location(nullToEmpty(document.getLocation()))
        .noteType(nullToEmpty(document.getType()))
        .author(nullToEmpty(document.getAuthor()))
        .created(nullToEmpty(document.getCreated()))
        .build();
  }
}
