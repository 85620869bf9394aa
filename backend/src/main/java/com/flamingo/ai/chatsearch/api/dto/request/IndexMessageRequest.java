package com.flamingo.ai.chatsearch.api.dto.request;

import com.flamingo.ai.chatsearch.elasticsearch.ChatMessageDocument;
import jakarta.validation.constraints.Size;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for indexing a chat message. The timestamp is assigned by the server.
 *
 * <p>Required fields are checked when the document is indexed, so a missing one is reported with
 * the field name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexMessageRequest {

  @Size(max = 255, message = "Message id must be at most 255 characters")
  private String id;

  private String content;

  private String userId;

  private String roomId;

  @Size(max = 64, message = "Message type must be at most 64 characters")
  private String messageType;

  private Map<String, Object> metadata;

  public ChatMessageDocument toDocument() {
    return ChatMessageDocument.builder()
        .id(id)
        .content(content)
        .userId(userId)
        .roomId(roomId)
        .messageType(messageType)
        .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
        .build();
  }
}
