package com.flamingo.ai.cliniclists.storage;

import com.flamingo.ai.cliniclists.exception.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/** {@link ObjectStore} backed by a directory tree. Each key maps to a file below the root. */
@Slf4j
public class FileSystemObjectStore implements ObjectStore {

  private final Path root;

  public FileSystemObjectStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public Optional<byte[]> get(String key) {
    Path file = resolve(key);
    try {
      return Optional.of(Files.readAllBytes(file));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new StorageException("Failed to read object", key, e);
    }
  }

  @Override
  public void put(String key, byte[] content) {
    Path file = resolve(key);
    try {
      Files.createDirectories(file.getParent());
      Files.write(file, content);
      log.debug("Stored {} bytes at {}", content.length, key);
    } catch (IOException e) {
      throw new StorageException("Failed to write object", key, e);
    }
  }

  @Override
  public List<String> list(String prefix) {
    Path dir = resolve(prefix);
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.walk(dir)) {
      return files
          .filter(Files::isRegularFile)
          .map(this::toKey)
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new StorageException("Failed to list objects", prefix, e);
    }
  }

  @Override
  public boolean delete(String key) {
    Path file = resolve(key);
    try {
      return Files.deleteIfExists(file);
    } catch (IOException e) {
      throw new StorageException("Failed to delete object", key, e);
    }
  }

  private Path resolve(String key) {
    if (key == null || key.isBlank()) {
      throw new StorageException("Object key must not be blank", String.valueOf(key));
    }
    Path resolved = root.resolve(key).normalize();
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      throw new StorageException("Object key escapes the store root", key);
    }
    return resolved;
  }

  private String toKey(Path file) {
    return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
  }
}
