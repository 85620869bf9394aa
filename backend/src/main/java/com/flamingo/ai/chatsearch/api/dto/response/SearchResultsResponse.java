package com.flamingo.ai.chatsearch.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO wrapping an ordered result list. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultsResponse<T> {

  private String domain;
  private String mode;
  private int count;
  private List<T> results;

  public static <T> SearchResultsResponse<T> of(String domain, String mode, List<T> results) {
    return SearchResultsResponse.<T>builder()
        .domain(domain)
        .mode(mode)
        .count(results.size())
        .results(results)
        .build();
  }
}
