package com.flamingo.ai.chatsearch.service.search.cache;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** In-process cache store for local runs without Redis. Entries expire lazily on read. */
@Component
@ConditionalOnProperty(name = "search.cache.store", havingValue = "memory")
public class InMemoryCacheStore implements CacheStore {

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryCacheStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<String> get(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (!clock.instant().isBefore(entry.expiresAt())) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  @Override
  public void set(String key, String value, long ttlSeconds) {
    entries.put(key, new Entry(value, clock.instant().plusSeconds(ttlSeconds)));
  }

  int size() {
    return entries.size();
  }

  private record Entry(String value, Instant expiresAt) {}
}
