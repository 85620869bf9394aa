package com.flamingo.ai.chatsearch.api.dto.request;

import com.flamingo.ai.chatsearch.elasticsearch.UserDocument;
import jakarta.validation.constraints.Size;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for indexing a user. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexUserRequest {

  @Size(max = 255, message = "User id must be at most 255 characters")
  private String userId;

  @Size(max = 255, message = "Username must be at most 255 characters")
  private String username;

  @Size(max = 320, message = "Email must be at most 320 characters")
  private String email;

  private Map<String, Object> metadata;

  public UserDocument toDocument() {
    return UserDocument.builder()
        .userId(userId)
        .username(username)
        .email(email)
        .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
        .build();
  }
}
