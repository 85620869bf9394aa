package com.flamingo.ai.chatsearch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a semantic message search driven by free-text context. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SemanticSearchRequest {

  @Size(max = 1000, message = "Query must be at most 1000 characters")
  private String query;

  @NotBlank(message = "Context is required")
  @Size(max = 5000, message = "Context must be at most 5000 characters")
  private String context;

  private Map<String, Object> filters;

  @Positive(message = "Limit must be positive")
  private Integer limit;
}
