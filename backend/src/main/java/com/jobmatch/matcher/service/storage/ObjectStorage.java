package com.jobmatch.matcher.service.storage;

import java.util.List;

/**
 * Hierarchical key/value blob store. Keys are slash-separated paths such as {@code
 * clustering_results/apec/france/manifest.json}. Each single-key write is atomic; nothing spans
 * keys.
 */
public interface ObjectStorage {

  /**
   * @throws com.jobmatch.matcher.exception.ResourceNotFoundException if the key does not exist
   * @throws com.jobmatch.matcher.exception.StorageException on any other failure
   */
  byte[] get(String key);

  void put(String key, byte[] content);

  /** Removes the key; removing a missing key is not an error. */
  void delete(String key);

  boolean exists(String key);

  /** All keys starting with {@code prefix}, in lexical order. */
  List<String> list(String prefix);

  default void copy(String sourceKey, String targetKey) {
    put(targetKey, get(sourceKey));
  }
}
