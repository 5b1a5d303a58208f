package com.jobmatch.matcher.service.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.exception.ResourceNotFoundException;
import com.jobmatch.matcher.exception.StorageException;

import lombok.extern.slf4j.Slf4j;

/**
 * Object store backed by a directory on disk, used for development and tests. Writes go to a
 * temporary file that is then moved over the key, so single-key writes are atomic.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "matcher.storage.type", havingValue = "local", matchIfMissing = true)
public class LocalObjectStorage implements ObjectStorage {

  private final Path root;

  @Autowired
  public LocalObjectStorage(MatcherProperties properties) {
    this(Paths.get(properties.getStorage().getRootDirectory()));
  }

  public LocalObjectStorage(Path root) {
    this.root = root.toAbsolutePath().normalize();
    log.info("Local object storage rooted at {}", this.root);
  }

  @Override
  public byte[] get(String key) {
    try {
      return Files.readAllBytes(resolve(key));
    } catch (NoSuchFileException e) {
      throw new ResourceNotFoundException("Object not found: " + key);
    } catch (IOException e) {
      throw new StorageException("Failed to read " + key, e);
    }
  }

  @Override
  public void put(String key, byte[] content) {
    Path target = resolve(key);
    try {
      Files.createDirectories(target.getParent());
      Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
      Files.write(temp, content);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new StorageException("Failed to write " + key, e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      Files.deleteIfExists(resolve(key));
    } catch (IOException e) {
      throw new StorageException("Failed to delete " + key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    return Files.isRegularFile(resolve(key));
  }

  @Override
  public List<String> list(String prefix) {
    if (!Files.isDirectory(root)) {
      return List.of();
    }
    try (Stream<Path> files = Files.walk(root)) {
      return files
          .filter(Files::isRegularFile)
          .map(path -> root.relativize(path).toString().replace('\\', '/'))
          .filter(key -> key.startsWith(prefix) && !isUploadTemp(key))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new StorageException("Failed to list " + prefix, e);
    }
  }

  private static boolean isUploadTemp(String key) {
    String name = key.substring(key.lastIndexOf('/') + 1);
    return name.startsWith(".upload-") && name.endsWith(".tmp");
  }

  private Path resolve(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Storage key must not be blank");
    }
    Path path = root.resolve(key).normalize();
    if (!path.startsWith(root)) {
      throw new IllegalArgumentException("Storage key escapes the storage root: " + key);
    }
    return path;
  }
}
