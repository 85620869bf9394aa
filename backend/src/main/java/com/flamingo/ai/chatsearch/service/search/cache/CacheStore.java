package com.flamingo.ai.chatsearch.service.search.cache;

import com.flamingo.ai.chatsearch.exception.CacheUnavailableException;
import java.util.Optional;

/**
 * Boundary to the key-value store holding cached result sets.
 *
 * <p>{@link #set} must replace any prior value for the key atomically; concurrent writers never
 * interleave partial values.
 */
public interface CacheStore {

  /**
   * Reads a value.
   *
   * @param key the full cache key
   * @return the stored value, or empty on a miss
   * @throws CacheUnavailableException if the store cannot be reached
   */
  Optional<String> get(String key);

  /**
   * Writes a value that expires after the given number of seconds.
   *
   * @param key the full cache key
   * @param value the value to store
   * @param ttlSeconds time-to-live in seconds
   * @throws CacheUnavailableException if the store cannot be reached
   */
  void set(String key, String value, long ttlSeconds);
}
