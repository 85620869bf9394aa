package com.flamingo.ai.chatsearch.elasticsearch;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents a chat room stored in Elasticsearch.
 *
 * <p>{@code members} is indexed as a keyword field so room search can filter on membership.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RoomDocument implements SearchDocument {

  private String roomId;

  private String name;

  @Builder.Default private String description = "";

  @JsonDeserialize(as = LinkedHashSet.class)
  private Set<String> members;

  @Builder.Default private Map<String, Object> metadata = new LinkedHashMap<>();

  @Builder.Default private double relevanceScore = 0.0;

  @Override
  public String documentId() {
    return roomId;
  }

  @Override
  public SearchDomain domain() {
    return SearchDomain.ROOMS;
  }
}
