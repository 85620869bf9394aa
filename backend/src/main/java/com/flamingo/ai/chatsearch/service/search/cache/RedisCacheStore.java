package com.flamingo.ai.chatsearch.service.search.cache;

import com.flamingo.ai.chatsearch.exception.CacheUnavailableException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** Redis-backed cache store. Writes use {@code SET key value EX ttl}, atomic per key. */
@Component
@ConditionalOnProperty(name = "search.cache.store", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RedisCacheStore implements CacheStore {

  private final StringRedisTemplate redisTemplate;

  @Override
  public Optional<String> get(String key) {
    try {
      return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("Redis read failed for " + key, e);
    }
  }

  @Override
  public void set(String key, String value, long ttlSeconds) {
    try {
      redisTemplate.opsForValue().set(key, value, ttlSeconds, TimeUnit.SECONDS);
      log.debug("Cached value in Redis: key={}, ttl={}s", key, ttlSeconds);
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("Redis write failed for " + key, e);
    }
  }
}
