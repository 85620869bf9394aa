package com.flamingo.ai.chatsearch.elasticsearch;

import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import java.util.Map;

/** Common view over the documents stored in the search indices. */
public interface SearchDocument {

  /** Stable identifier used as the Elasticsearch {@code _id}. */
  String documentId();

  SearchDomain domain();

  Map<String, Object> getMetadata();

  double getRelevanceScore();

  void setRelevanceScore(double relevanceScore);
}
