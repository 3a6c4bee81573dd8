package com.flamingo.ai.cliniclists.elasticsearch;

import com.flamingo.ai.cliniclists.service.index.BulkIndexOutcome;
import java.util.List;
import java.util.Map;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 * @param <ID> the document ID type
 */
public interface ElasticsearchIndexOperations<T, ID> {

  /**
   * Initializes the index with appropriate mappings.
   *
   * <p>Creates the index if it doesn't exist, using the schema defined by the implementation.
   */
  void initIndex();

  /**
   * Indexes multiple documents in bulk.
   *
   * @param documents the documents to index
   * @return documents stored and per-document errors
   */
  BulkIndexOutcome indexDocuments(List<T> documents);

  /**
   * Searches with filters and an optional free-text query.
   *
   * @param filterCriteria key-value pairs for filtering (e.g., ownerId, fileName)
   * @param query the search query text, blank to match everything
   * @param from offset of the first hit
   * @param size number of hits to return
   * @return total hit count and the requested page of documents
   */
  SearchPage<T> search(Map<String, Object> filterCriteria, String query, int from, int size);

  /**
   * Deletes documents matching the given criteria.
   *
   * @param criteria key-value pairs for filtering documents to delete
   * @return number of documents deleted
   */
  long deleteBy(Map<String, Object> criteria);

  /** Refreshes the index to make recent changes visible for search. */
  void refresh();

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
