package com.flamingo.ai.cliniclists.service.lists;

/**
 * A category file written during ingest.
 *
 * @param category category heading text
 * @param key object key of the markdown file
 * @param observationCount observations in the file
 */
public record ObservationFile(String category, String key, int observationCount) {}
