package com.flamingo.ai.cliniclists.service.lists;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.cliniclists.domain.model.ListArtifact;
import com.flamingo.ai.cliniclists.exception.StorageException;
import com.flamingo.ai.cliniclists.storage.ObjectStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reads and writes list artifacts as JSON. Both directions are best effort. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ListArtifactStore {

  private final ObjectStore objectStore;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /** Reads the artifact at the key. A missing or unreadable artifact is reported as empty. */
  public Optional<ListArtifact> read(String key) {
    try {
      Optional<byte[]> content = objectStore.get(key);
      if (content.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(objectMapper.readValue(content.get(), ListArtifact.class));
    } catch (IOException | StorageException e) {
      log.warn("Ignoring unreadable list artifact {}: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Writes the artifact, replacing any previous one at the key.
   *
   * @return the failure message when the write failed, empty on success
   */
  public Optional<String> save(String key, ListArtifact artifact) {
    try {
      objectStore.put(key, objectMapper.writeValueAsBytes(artifact));
      log.debug("Saved list artifact {} with {} record(s)", key, artifact.getRecords().size());
      return Optional.empty();
    } catch (IOException | StorageException e) {
      log.warn("Failed to save list artifact {}: {}", key, e.getMessage());
      meterRegistry.counter("lists.cache.write.failure").increment();
      return Optional.of("Failed to save list: " + e.getMessage());
    }
  }
}
