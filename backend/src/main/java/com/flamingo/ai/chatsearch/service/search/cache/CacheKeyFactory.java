package com.flamingo.ai.chatsearch.service.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.chatsearch.config.SearchConfig;
import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import com.flamingo.ai.chatsearch.domain.enums.SearchMode;
import com.flamingo.ai.chatsearch.service.search.query.QueryIntent;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Derives result-cache keys.
 *
 * <p>Key format: {@code <prefix><domain>:<sha-256 of canonical JSON>}. The canonical JSON holds the
 * raw query, filters sorted by field name, the domain tag, and the remaining intent fields that
 * change the answer (mode, context, limit, requester). Logically identical queries map to the same
 * key whatever order the caller gave the filters in.
 */
@Component
@RequiredArgsConstructor
public class CacheKeyFactory {

  private final ObjectMapper objectMapper;
  private final SearchConfig searchConfig;

  public String key(SearchDomain domain, SearchMode mode, QueryIntent intent) {
    return searchConfig.getCache().getKeyPrefix()
        + domain.getTag()
        + ":"
        + sha256(canonicalForm(domain, mode, intent));
  }

  String canonicalForm(SearchDomain domain, SearchMode mode, QueryIntent intent) {
    Map<String, Object> canonical = new LinkedHashMap<>();
    canonical.put("domain", domain.getTag());
    canonical.put("mode", mode.name());
    canonical.put("query", intent.query());
    canonical.put("filters", new TreeMap<>(intent.filters()));
    canonical.put("context", intent.context());
    canonical.put("limit", intent.limit());
    canonical.put("requester", intent.requesterId());
    try {
      return objectMapper.writeValueAsString(canonical);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render cache key for " + domain.getTag(), e);
    }
  }

  private static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
