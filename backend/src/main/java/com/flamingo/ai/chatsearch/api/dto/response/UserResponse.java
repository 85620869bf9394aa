package com.flamingo.ai.chatsearch.api.dto.response;

import com.flamingo.ai.chatsearch.elasticsearch.UserDocument;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a user. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

  private String userId;
  private String username;
  private String email;
  private Map<String, Object> metadata;
  private double score;

  public static UserResponse from(UserDocument user) {
    return UserResponse.builder()
        .userId(user.getUserId())
        .username(user.getUsername())
        .email(user.getEmail())
        .metadata(user.getMetadata())
        .score(user.getRelevanceScore())
        .build();
  }
}
