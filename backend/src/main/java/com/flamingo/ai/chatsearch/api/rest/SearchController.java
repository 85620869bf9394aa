package com.flamingo.ai.chatsearch.api.rest;

import com.flamingo.ai.chatsearch.api.dto.request.MessageSearchRequest;
import com.flamingo.ai.chatsearch.api.dto.request.SemanticSearchRequest;
import com.flamingo.ai.chatsearch.api.dto.response.MessageResponse;
import com.flamingo.ai.chatsearch.api.dto.response.RoomResponse;
import com.flamingo.ai.chatsearch.api.dto.response.SearchResultsResponse;
import com.flamingo.ai.chatsearch.api.dto.response.UserResponse;
import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import com.flamingo.ai.chatsearch.domain.enums.SearchMode;
import com.flamingo.ai.chatsearch.elasticsearch.ChatMessageDocument;
import com.flamingo.ai.chatsearch.elasticsearch.RoomDocument;
import com.flamingo.ai.chatsearch.elasticsearch.SearchDocument;
import com.flamingo.ai.chatsearch.elasticsearch.UserDocument;
import com.flamingo.ai.chatsearch.service.search.SearchOrchestrator;
import com.flamingo.ai.chatsearch.service.search.query.QueryIntent;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for lexical and semantic search over messages, users and rooms. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

  private final SearchOrchestrator searchOrchestrator;

  /** Searches message content, newest first. */
  @PostMapping("/messages")
  public ResponseEntity<SearchResultsResponse<MessageResponse>> searchMessages(
      @Valid @RequestBody MessageSearchRequest request) {
    QueryIntent intent =
        QueryIntent.builder()
            .query(request.getQuery())
            .filters(request.getFilters())
            .limit(request.getLimit())
            .build();
    return respond(SearchDomain.MESSAGES, SearchMode.LEXICAL, intent, this::toMessage);
  }

  /** Ranks messages by cosine similarity to the query and context. */
  @PostMapping("/messages/semantic")
  public ResponseEntity<SearchResultsResponse<MessageResponse>> semanticSearch(
      @Valid @RequestBody SemanticSearchRequest request) {
    QueryIntent intent =
        QueryIntent.builder()
            .query(request.getQuery())
            .context(request.getContext())
            .filters(request.getFilters())
            .limit(request.getLimit())
            .build();
    return respond(SearchDomain.MESSAGES, SearchMode.SEMANTIC, intent, this::toMessage);
  }

  @GetMapping("/users")
  public ResponseEntity<SearchResultsResponse<UserResponse>> searchUsers(
      @RequestParam("q") String query,
      @RequestParam(value = "limit", required = false) Integer limit) {
    QueryIntent intent = QueryIntent.builder().query(query).limit(limit).build();
    return respond(
        SearchDomain.USERS,
        SearchMode.LEXICAL,
        intent,
        document -> UserResponse.from((UserDocument) document));
  }

  /** Searches room names among the rooms the given user is a member of. */
  @GetMapping("/rooms")
  public ResponseEntity<SearchResultsResponse<RoomResponse>> searchRooms(
      @RequestParam("q") String query,
      @RequestParam("userId") String userId,
      @RequestParam(value = "limit", required = false) Integer limit) {
    QueryIntent intent =
        QueryIntent.builder().query(query).requesterId(userId).limit(limit).build();
    return respond(
        SearchDomain.ROOMS,
        SearchMode.LEXICAL,
        intent,
        document -> RoomResponse.from((RoomDocument) document));
  }

  private <T> ResponseEntity<SearchResultsResponse<T>> respond(
      SearchDomain domain,
      SearchMode mode,
      QueryIntent intent,
      Function<SearchDocument, T> mapper) {
    List<T> results = searchOrchestrator.search(domain, intent, mode).stream().map(mapper).toList();
    return ResponseEntity.ok(
        SearchResultsResponse.of(domain.getTag(), mode.name().toLowerCase(Locale.ROOT), results));
  }

  private MessageResponse toMessage(SearchDocument document) {
    return MessageResponse.from((ChatMessageDocument) document);
  }
}
