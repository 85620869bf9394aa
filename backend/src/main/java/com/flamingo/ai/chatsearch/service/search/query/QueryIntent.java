package com.flamingo.ai.chatsearch.service.search.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * What a caller wants to find.
 *
 * @param query free-text query; may be empty only for semantic queries driven by context
 * @param filters exact-match filters, all ANDed
 * @param context semantic context text
 * @param limit result-size limit, or null for the mode's default
 * @param requesterId the user performing the search; required for room search
 */
@Builder(toBuilder = true)
public record QueryIntent(
    String query, Map<String, Object> filters, String context, Integer limit, String requesterId) {

  public QueryIntent {
    query = query == null ? "" : query;
    filters =
        filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
  }

  public static QueryIntent of(String query) {
    return QueryIntent.builder().query(query).build();
  }

  public boolean hasContext() {
    return context != null && !context.isBlank();
  }
}
