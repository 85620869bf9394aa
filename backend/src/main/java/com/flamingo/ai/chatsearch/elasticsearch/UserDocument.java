package com.flamingo.ai.chatsearch.elasticsearch;

import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Represents a chat user stored in Elasticsearch. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserDocument implements SearchDocument {

  private String userId;

  /** Display name. Weighted above email when searching users. */
  private String username;

  private String email;

  @Builder.Default private Map<String, Object> metadata = new LinkedHashMap<>();

  @Builder.Default private double relevanceScore = 0.0;

  @Override
  public String documentId() {
    return userId;
  }

  @Override
  public SearchDomain domain() {
    return SearchDomain.USERS;
  }
}
