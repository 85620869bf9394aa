package com.flamingo.ai.chatsearch.api.dto.response;

import com.flamingo.ai.chatsearch.elasticsearch.RoomDocument;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a room. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomResponse {

  private String roomId;
  private String name;
  private String description;
  private Set<String> members;
  private Map<String, Object> metadata;
  private double score;

  public static RoomResponse from(RoomDocument room) {
    return RoomResponse.builder()
        .roomId(room.getRoomId())
        .name(room.getName())
        .description(room.getDescription())
        .members(room.getMembers())
        .metadata(room.getMetadata())
        .score(room.getRelevanceScore())
        .build();
  }
}
