package com.flamingo.ai.cliniclists.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.cliniclists.exception.IndexOperationException;
import com.flamingo.ai.cliniclists.service.index.BulkIndexOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides common functionality for indexing, searching, and deleting documents. Subclasses
 * define document-specific schema and conversion logic.
 *
 * <p>Subclasses call these methods on themselves; timing and circuit breaking go on the subclass's
 * public entry points.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T, String> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  /**
   * Converts a document entity to an Elasticsearch document map.
   *
   * @param entity the entity to convert
   * @return the Elasticsearch document map
   */
  protected abstract Map<String, Object> convertToDocument(T entity);

  /**
   * Converts an Elasticsearch document map to a document entity.
   *
   * @param source the Elasticsearch document map
   * @return the document entity
   */
  protected abstract T convertFromDocument(Map<String, Object> source);

  /**
   * Extracts the document ID from the entity.
   *
   * @param entity the entity
   * @return the document ID
   */
  protected abstract String getDocumentId(T entity);

  /**
   * Builds the search request with filters.
   *
   * @param filterCriteria the filter criteria
   * @param query the free-text query, may be blank
   * @param from offset of the first hit
   * @param size number of hits
   * @return the search request
   */
  protected abstract SearchRequest buildSearchRequest(
      Map<String, Object> filterCriteria, String query, int from, int size);

  /**
   * Builds the delete by query request with criteria.
   *
   * @param criteria the delete criteria
   * @return the delete query
   */
  protected abstract Query buildDeleteQuery(Map<String, Object> criteria);

  /**
   * Returns the metric prefix for this index (e.g., "clinical_record").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps undeclared fields out of the mapping
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches.
   *
   * <p>Elasticsearch allows adding new fields via the Put Mapping API but does not allow changing
   * the type of existing fields. Missing fields are added automatically; type mismatches cause the
   * application to fail fast so the index can be recreated manually.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      String field = entry.getKey();
      Property expected = entry.getValue();
      Property actual = actualProperties.get(field);
      if (actual != null && expected._kind() != actual._kind()) {
        String msg =
            String.format(
                "Mapping mismatch in index '%s': field '%s' expected type '%s' but found '%s'. "
                    + "Delete the index and restart the application to apply correct mappings.",
                getIndexName(), field, expected._kind(), actual._kind());
        log.error(msg);
        mismatches.add(msg);
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s). "
              + String.join("; ", mismatches));
    }

    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      if (!actualProperties.containsKey(entry.getKey())) {
        missingFields.put(entry.getKey(), entry.getValue());
      }
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  @Override
  public BulkIndexOutcome indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return new BulkIndexOutcome(0, List.of());
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      List<String> errors = new ArrayList<>();
      if (response.errors()) {
        for (BulkResponseItem item : response.items()) {
          if (item.error() != null) {
            errors.add(item.id() + ": " + item.error().reason());
          }
        }
        log.warn("{} document(s) failed to index in {}", errors.size(), getIndexName());
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment(errors.size());
      }
      int indexed = documents.size() - errors.size();
      log.debug("Indexed {} documents to {}", indexed, getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(indexed);
      return new BulkIndexOutcome(indexed, errors);
    } catch (IOException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexOperationException("Failed to index documents", e);
    }
  }

  @Override
  public SearchPage<T> search(
      Map<String, Object> filterCriteria, String query, int from, int size) {
    try {
      SearchRequest request = buildSearchRequest(filterCriteria, query, from, size);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      long total = response.hits().total() != null ? response.hits().total().value() : hits.size();
      log.debug(
          "[search] index={} query='{}' totalHits={} returned={}",
          getIndexName(),
          query,
          total,
          hits.size());
      meterRegistry.counter(getMetricPrefix() + ".search").increment();
      return new SearchPage<>(total, mapHitsToDocuments(hits));
    } catch (IOException e) {
      log.error("Search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexOperationException("Search failed", e);
    }
  }

  @Override
  public long deleteBy(Map<String, Object> criteria) {
    try {
      Query deleteQuery = buildDeleteQuery(criteria);
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery));
      DeleteByQueryResponse response = elasticsearchClient.deleteByQuery(request);
      long deleted = response.deleted() != null ? response.deleted() : 0L;
      log.info(
          "Deleted {} document(s) from {} with criteria: {}", deleted, getIndexName(), criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
      return deleted;
    } catch (IOException e) {
      log.error(
          "Failed to delete documents from {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage(),
          e);
      throw new IndexOperationException("Failed to delete documents", e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata and not part of _source
        source.put("id", hit.id());
        documents.add(convertFromDocument(source));
      }
    }
    return documents;
  }
}
