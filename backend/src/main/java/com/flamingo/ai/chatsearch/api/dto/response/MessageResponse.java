package com.flamingo.ai.chatsearch.api.dto.response;

import com.flamingo.ai.chatsearch.elasticsearch.ChatMessageDocument;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chat message. The content vector is never exposed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {

  private String id;
  private String content;
  private String userId;
  private String roomId;
  private Long timestamp;
  private String messageType;
  private Map<String, Object> metadata;
  private double score;

  public static MessageResponse from(ChatMessageDocument message) {
    return MessageResponse.builder()
        .id(message.getId())
        .content(message.getContent())
        .userId(message.getUserId())
        .roomId(message.getRoomId())
        .timestamp(message.getTimestamp())
        .messageType(message.getMessageType())
        .metadata(message.getMetadata())
        .score(message.getRelevanceScore())
        .build();
  }
}
