package com.flamingo.ai.chatsearch.service.search.query;

import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import java.util.List;

/**
 * Backend-agnostic search request: ordered match clauses, ordered term filters, sort and size.
 *
 * <p>Records compare by value, so two builds of the same intent are equal.
 */
public record StructuredRequest(
    SearchDomain domain,
    List<MatchClause> matches,
    List<FilterClause> filters,
    List<SortSpec> sort,
    int size) {

  public StructuredRequest {
    matches = List.copyOf(matches);
    filters = List.copyOf(filters);
    sort = List.copyOf(sort);
  }

  public boolean isVectorQuery() {
    return matches.stream().anyMatch(MatchClause.VectorSimilarity.class::isInstance);
  }
}
