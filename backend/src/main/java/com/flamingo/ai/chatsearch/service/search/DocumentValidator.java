package com.flamingo.ai.chatsearch.service.search;

import com.flamingo.ai.chatsearch.elasticsearch.ChatMessageDocument;
import com.flamingo.ai.chatsearch.elasticsearch.IndexFields;
import com.flamingo.ai.chatsearch.elasticsearch.RoomDocument;
import com.flamingo.ai.chatsearch.elasticsearch.SearchDocument;
import com.flamingo.ai.chatsearch.elasticsearch.UserDocument;
import com.flamingo.ai.chatsearch.exception.MissingFieldException;
import java.util.Collection;
import org.springframework.stereotype.Component;

/**
 * Checks the attributes each document type must carry.
 *
 * <p>Messages need content, userId and roomId; users need username and email; rooms need name and
 * members. A member set with a null or blank entry counts as missing.
 */
@Component
public class DocumentValidator {

  /**
   * Validates the required fields of a document.
   *
   * @param document the document to check
   * @throws MissingFieldException naming the first absent field
   */
  public void requireFields(SearchDocument document) {
    if (document instanceof ChatMessageDocument message) {
      require(message, IndexFields.CONTENT, message.getContent());
      require(message, IndexFields.USER_ID, message.getUserId());
      require(message, IndexFields.ROOM_ID, message.getRoomId());
    } else if (document instanceof UserDocument user) {
      require(user, IndexFields.USERNAME, user.getUsername());
      require(user, IndexFields.EMAIL, user.getEmail());
    } else if (document instanceof RoomDocument room) {
      require(room, IndexFields.NAME, room.getName());
      require(room, IndexFields.MEMBERS, room.getMembers());
    } else {
      throw new IllegalArgumentException("Unsupported document type: " + document);
    }
  }

  private static void require(SearchDocument document, String field, Object value) {
    boolean absent =
        value == null
            || (value instanceof String s && s.isBlank())
            || (value instanceof Collection<?> c
                && (c.isEmpty() || c.stream().anyMatch(DocumentValidator::isBlankElement)));
    if (absent) {
      throw new MissingFieldException(document.domain(), field);
    }
  }

  private static boolean isBlankElement(Object element) {
    return element == null || (element instanceof String s && s.isBlank());
  }
}
