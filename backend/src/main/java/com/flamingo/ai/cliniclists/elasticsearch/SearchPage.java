package com.flamingo.ai.cliniclists.elasticsearch;

import java.util.List;

/**
 * A page of search hits.
 *
 * @param total total matching documents
 * @param hits documents on this page
 * @param <T> the document type
 */
public record SearchPage<T>(long total, List<T> hits) {}
