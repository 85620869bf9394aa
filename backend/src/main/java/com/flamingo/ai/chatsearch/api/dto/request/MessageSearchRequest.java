package com.flamingo.ai.chatsearch.api.dto.request;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a lexical message search. Filters are exact matches on stored fields. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageSearchRequest {

  @Size(max = 1000, message = "Query must be at most 1000 characters")
  private String query;

  private Map<String, Object> filters;

  @Positive(message = "Limit must be positive")
  private Integer limit;
}
