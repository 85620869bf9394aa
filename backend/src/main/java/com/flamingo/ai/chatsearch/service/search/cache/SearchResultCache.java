package com.flamingo.ai.chatsearch.service.search.cache;

import com.flamingo.ai.chatsearch.config.SearchConfig;
import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import com.flamingo.ai.chatsearch.elasticsearch.SearchDocument;
import com.flamingo.ai.chatsearch.exception.CacheUnavailableException;
import com.flamingo.ai.chatsearch.exception.MalformedCacheEntryException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Time-bounded store of complete result sets.
 *
 * <p>Cache failures never fail a search: an unreachable store or an unreadable entry is a miss, and
 * a failed write is skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchResultCache {

  private final CacheStore cacheStore;
  private final ResultCodec resultCodec;
  private final SearchConfig searchConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Looks up a cached result set.
   *
   * @param key the cache key
   * @param domain the domain being searched
   * @return the cached documents, or empty on a miss
   */
  public Optional<List<SearchDocument>> get(String key, SearchDomain domain) {
    if (!searchConfig.getCache().isEnabled()) {
      return Optional.empty();
    }
    Optional<String> payload;
    try {
      payload = cacheStore.get(key);
    } catch (CacheUnavailableException e) {
      log.warn("Cache read failed for {}, treating as miss: {}", key, e.getMessage());
      countError(domain, "unavailable");
      countMiss(domain);
      return Optional.empty();
    }
    if (payload.isEmpty()) {
      countMiss(domain);
      return Optional.empty();
    }
    try {
      List<SearchDocument> documents =
          resultCodec.decode(payload.get(), domain, clock.instant());
      log.debug("Cache hit for {} ({} documents)", key, documents.size());
      meterRegistry.counter("search.cache.hit", "domain", domain.getTag()).increment();
      return Optional.of(documents);
    } catch (MalformedCacheEntryException e) {
      log.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
      countError(domain, "malformed");
      countMiss(domain);
      return Optional.empty();
    }
  }

  /**
   * Stores a complete result set, replacing any previous value under the key.
   *
   * @param key the cache key
   * @param domain the domain the results belong to
   * @param results the full result list
   * @param ttlSeconds time-to-live in seconds
   */
  public void put(
      String key, SearchDomain domain, List<? extends SearchDocument> results, long ttlSeconds) {
    if (!searchConfig.getCache().isEnabled()) {
      return;
    }
    Instant now = clock.instant();
    String payload = resultCodec.encode(domain, results, now, ttlSeconds);
    try {
      cacheStore.set(key, payload, ttlSeconds);
      log.debug("Cached {} {} results under {} for {}s", results.size(), domain, key, ttlSeconds);
    } catch (CacheUnavailableException e) {
      log.warn("Cache write failed for {}, skipping: {}", key, e.getMessage());
      countError(domain, "unavailable");
    }
  }

  /** Stores a result set with the configured time-to-live. */
  public void put(String key, SearchDomain domain, List<? extends SearchDocument> results) {
    put(key, domain, results, searchConfig.getCache().getTtlSeconds());
  }

  private void countMiss(SearchDomain domain) {
    meterRegistry.counter("search.cache.miss", "domain", domain.getTag()).increment();
  }

  private void countError(SearchDomain domain, String reason) {
    meterRegistry
        .counter("search.cache.error", "domain", domain.getTag(), "reason", reason)
        .increment();
  }
}
