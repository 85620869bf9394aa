package com.flamingo.ai.chatsearch.service.search;

import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import com.flamingo.ai.chatsearch.exception.BackendUnavailableException;
import com.flamingo.ai.chatsearch.service.search.query.StructuredRequest;
import java.util.List;
import java.util.Map;

/** Boundary to the full-text search engine that stores and ranks documents. */
public interface SearchBackend {

  /**
   * Stores a document body in the index of the given domain.
   *
   * @param domain the target collection
   * @param id the document id
   * @param body the document body
   * @throws BackendUnavailableException if the engine cannot be reached or rejects the write
   */
  void index(SearchDomain domain, String id, Map<String, Object> body);

  /**
   * Executes a structured request.
   *
   * @param request the request to execute
   * @return raw hits in the engine's relevance order
   * @throws BackendUnavailableException if the engine cannot be reached or fails the query
   */
  List<RawHit> search(StructuredRequest request);

  /**
   * Makes recent writes to a domain visible to searches.
   *
   * @param domain the collection to refresh
   * @throws BackendUnavailableException if the engine cannot be reached
   */
  void refresh(SearchDomain domain);

  /** A raw hit as returned by the engine. */
  record RawHit(String id, Double score, Map<String, Object> source) {}
}
