package com.flamingo.ai.chatsearch.elasticsearch;

import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import com.flamingo.ai.chatsearch.service.search.SearchBackend.RawHit;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Converts between search documents and the bodies stored in Elasticsearch. */
@Component
public class DocumentMapper {

  /**
   * Converts a document to its stored body.
   *
   * @param document the document
   * @return the Elasticsearch document map
   */
  public Map<String, Object> toSource(SearchDocument document) {
    Map<String, Object> doc = new HashMap<>();
    if (document instanceof ChatMessageDocument message) {
      doc.put(IndexFields.CONTENT, message.getContent());
      doc.put(IndexFields.USER_ID, message.getUserId());
      doc.put(IndexFields.ROOM_ID, message.getRoomId());
      doc.put(IndexFields.TIMESTAMP, message.getTimestamp());
      doc.put(IndexFields.MESSAGE_TYPE, message.getMessageType());
      if (message.getContentVector() != null) {
        doc.put(IndexFields.CONTENT_VECTOR, message.getContentVector());
      }
    } else if (document instanceof UserDocument user) {
      doc.put(IndexFields.USER_ID, user.getUserId());
      doc.put(IndexFields.USERNAME, user.getUsername());
      doc.put(IndexFields.EMAIL, user.getEmail());
    } else if (document instanceof RoomDocument room) {
      doc.put(IndexFields.ROOM_ID, room.getRoomId());
      doc.put(IndexFields.NAME, room.getName());
      doc.put(IndexFields.DESCRIPTION, room.getDescription() != null ? room.getDescription() : "");
      doc.put(IndexFields.MEMBERS, List.copyOf(room.getMembers()));
    } else {
      throw new IllegalArgumentException("Unsupported document type: " + document.getClass());
    }
    doc.put(
        IndexFields.METADATA,
        document.getMetadata() != null ? document.getMetadata() : Map.of());
    return doc;
  }

  /**
   * Converts a raw hit into a typed document. The stored content vector is never copied over.
   *
   * @param domain the domain the hit came from
   * @param hit the raw hit
   * @return the document with its relevance score set
   */
  public SearchDocument fromHit(SearchDomain domain, RawHit hit) {
    Map<String, Object> source = hit.source() != null ? hit.source() : Map.of();
    SearchDocument document =
        switch (domain) {
          case MESSAGES -> ChatMessageDocument.builder()
              .id(hit.id())
              .content(asString(source.get(IndexFields.CONTENT)))
              .userId(asString(source.get(IndexFields.USER_ID)))
              .roomId(asString(source.get(IndexFields.ROOM_ID)))
              .timestamp(
                  source.get(IndexFields.TIMESTAMP) != null
                      ? ((Number) source.get(IndexFields.TIMESTAMP)).longValue()
                      : null)
              .messageType(asString(source.get(IndexFields.MESSAGE_TYPE)))
              .metadata(metadata(source))
              .build();
          case USERS -> UserDocument.builder()
              .userId(
                  source.get(IndexFields.USER_ID) != null
                      ? asString(source.get(IndexFields.USER_ID))
                      : hit.id())
              .username(asString(source.get(IndexFields.USERNAME)))
              .email(asString(source.get(IndexFields.EMAIL)))
              .metadata(metadata(source))
              .build();
          case ROOMS -> RoomDocument.builder()
              .roomId(
                  source.get(IndexFields.ROOM_ID) != null
                      ? asString(source.get(IndexFields.ROOM_ID))
                      : hit.id())
              .name(asString(source.get(IndexFields.NAME)))
              .description(
                  source.get(IndexFields.DESCRIPTION) != null
                      ? asString(source.get(IndexFields.DESCRIPTION))
                      : "")
              .members(members(source.get(IndexFields.MEMBERS)))
              .metadata(metadata(source))
              .build();
        };
    document.setRelevanceScore(hit.score() != null ? hit.score() : 0.0);
    return document;
  }

  private static String asString(Object value) {
    return value != null ? value.toString() : null;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> metadata(Map<String, Object> source) {
    Object metadata = source.get(IndexFields.METADATA);
    if (metadata instanceof Map<?, ?> map) {
      return new LinkedHashMap<>((Map<String, Object>) map);
    }
    return new LinkedHashMap<>();
  }

  private static LinkedHashSet<String> members(Object value) {
    LinkedHashSet<String> members = new LinkedHashSet<>();
    if (value instanceof Collection<?> collection) {
      collection.forEach(member -> members.add(member.toString()));
    } else if (value != null) {
      members.add(value.toString());
    }
    return members;
  }
}
