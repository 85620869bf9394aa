package com.flamingo.ai.chatsearch.elasticsearch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents a chat message stored in Elasticsearch with text and vector embedding.
 *
 * <p>The timestamp is assigned when the message is indexed and is never taken from the caller.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageDocument implements SearchDocument {

  /** Message ID. Generated at index time when the caller does not supply one. */
  private String id;

  /** Message content (text). */
  private String content;

  /** Author of the message. */
  private String userId;

  /** Room the message was posted in. */
  private String roomId;

  /** Message timestamp (epoch milliseconds). */
  private Long timestamp;

  /** Message type, e.g. text or image. */
  private String messageType;

  @Builder.Default private Map<String, Object> metadata = new LinkedHashMap<>();

  /** Vector of the content for semantic search. Never returned to callers. */
  @JsonIgnore private List<Float> contentVector;

  /** Relevance score from search results (set by search methods). */
  @Builder.Default private double relevanceScore = 0.0;

  @Override
  public String documentId() {
    return id;
  }

  @Override
  public SearchDomain domain() {
    return SearchDomain.MESSAGES;
  }
}
