package com.flamingo.ai.cliniclists.config;

import com.flamingo.ai.cliniclists.storage.FileSystemObjectStore;
import com.flamingo.ai.cliniclists.storage.ObjectStore;
import java.nio.file.Path;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the object store and the clock used for processing timestamps. */
@Configuration
@Slf4j
public class StorageConfig {

  @Bean
  public ObjectStore objectStore(ListsConfig listsConfig) {
    Path root = Path.of(listsConfig.getStorage().getBasePath()).toAbsolutePath().normalize();
    log.info("Using filesystem object store at {}", root);
    return new FileSystemObjectStore(root);
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
