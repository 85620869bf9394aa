package com.flamingo.ai.chatsearch.elasticsearch;

/** Field names of the stored message, user and room documents. */
public final class IndexFields {

  public static final String CONTENT = "content";
  public static final String USER_ID = "userId";
  public static final String ROOM_ID = "roomId";
  public static final String TIMESTAMP = "timestamp";
  public static final String MESSAGE_TYPE = "messageType";
  public static final String CONTENT_VECTOR = "content_vector";

  public static final String USERNAME = "username";
  public static final String EMAIL = "email";

  public static final String NAME = "name";
  public static final String DESCRIPTION = "description";
  public static final String MEMBERS = "members";

  public static final String METADATA = "metadata";

  private IndexFields() {}
}
