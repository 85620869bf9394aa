package com.flamingo.ai.chatsearch.api.dto.request;

import com.flamingo.ai.chatsearch.elasticsearch.RoomDocument;
import jakarta.validation.constraints.Size;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for indexing a room with its member list. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexRoomRequest {

  @Size(max = 255, message = "Room id must be at most 255 characters")
  private String roomId;

  @Size(max = 255, message = "Room name must be at most 255 characters")
  private String name;

  private String description;

  private Set<String> members;

  private Map<String, Object> metadata;

  public RoomDocument toDocument() {
    return RoomDocument.builder()
        .roomId(roomId)
        .name(name)
        .description(description != null ? description : "")
        .members(members != null ? new LinkedHashSet<>(members) : null)
        .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
        .build();
  }
}
