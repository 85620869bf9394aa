package com.flamingo.ai.chatsearch.service.search.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chatsearch.exception.CacheUnavailableException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisCacheStore Tests")
class RedisCacheStoreTest {

  @Mock private StringRedisTemplate redisTemplate;
  @Mock private ValueOperations<String, String> valueOperations;

  private RedisCacheStore store;

  @BeforeEach
  void setUp() {
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    store = new RedisCacheStore(redisTemplate);
  }

  @Test
  @DisplayName("should write with an expiry in seconds")
  void shouldWriteWithExpiry() {
    store.set("search:messages:abc", "{}", 300);

    verify(valueOperations).set("search:messages:abc", "{}", 300, TimeUnit.SECONDS);
  }

  @Test
  @DisplayName("should report a missing key as empty")
  void shouldReportMissingKey() {
    when(valueOperations.get("search:users:abc")).thenReturn(null);

    assertThat(store.get("search:users:abc")).isEmpty();
  }

  @Test
  @DisplayName("should translate connection failures")
  void shouldTranslateConnectionFailures() {
    when(valueOperations.get("k")).thenThrow(new RedisConnectionFailureException("refused"));
    doThrow(new RedisConnectionFailureException("refused"))
        .when(valueOperations)
        .set("k", "v", 300, TimeUnit.SECONDS);

    assertThatThrownBy(() -> store.get("k")).isInstanceOf(CacheUnavailableException.class);
    assertThatThrownBy(() -> store.set("k", "v", 300))
        .isInstanceOf(CacheUnavailableException.class);
  }
}
