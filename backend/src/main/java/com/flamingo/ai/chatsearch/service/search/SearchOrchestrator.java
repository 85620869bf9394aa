package com.flamingo.ai.chatsearch.service.search;

import com.flamingo.ai.chatsearch.config.SearchConfig;
import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import com.flamingo.ai.chatsearch.domain.enums.SearchMode;
import com.flamingo.ai.chatsearch.elasticsearch.ChatMessageDocument;
import com.flamingo.ai.chatsearch.elasticsearch.DocumentMapper;
import com.flamingo.ai.chatsearch.elasticsearch.RoomDocument;
import com.flamingo.ai.chatsearch.elasticsearch.SearchDocument;
import com.flamingo.ai.chatsearch.elasticsearch.UserDocument;
import com.flamingo.ai.chatsearch.exception.VectorizationException;
import com.flamingo.ai.chatsearch.service.search.SearchBackend.RawHit;
import com.flamingo.ai.chatsearch.service.search.cache.CacheKeyFactory;
import com.flamingo.ai.chatsearch.service.search.cache.SearchResultCache;
import com.flamingo.ai.chatsearch.service.search.query.QueryBuilder;
import com.flamingo.ai.chatsearch.service.search.query.QueryIntent;
import com.flamingo.ai.chatsearch.service.search.query.StructuredRequest;
import com.flamingo.ai.chatsearch.service.vectorizer.VectorizerService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Entry point for indexing and searching chat messages, users and rooms.
 *
 * <p>Each search first consults the result cache. A miss builds a structured request, dispatches it
 * to the backend exactly once, normalizes the hits and writes the complete result list back to the
 * cache. Backend errors propagate and are never cached. Writes do not invalidate cached results;
 * staleness is bounded by the cache TTL.
 */
@Service
@Slf4j
public class SearchOrchestrator {

  private final SearchBackend searchBackend;
  private final QueryBuilder queryBuilder;
  private final SearchResultCache resultCache;
  private final CacheKeyFactory cacheKeyFactory;
  private final DocumentMapper documentMapper;
  private final DocumentValidator documentValidator;
  private final VectorizerService vectorizerService;
  private final SearchConfig searchConfig;
  private final AsyncTaskExecutor searchExecutor;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public SearchOrchestrator(
      SearchBackend searchBackend,
      QueryBuilder queryBuilder,
      SearchResultCache resultCache,
      CacheKeyFactory cacheKeyFactory,
      DocumentMapper documentMapper,
      DocumentValidator documentValidator,
      VectorizerService vectorizerService,
      SearchConfig searchConfig,
      @Qualifier("searchExecutor") AsyncTaskExecutor searchExecutor,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.searchBackend = searchBackend;
    this.queryBuilder = queryBuilder;
    this.resultCache = resultCache;
    this.cacheKeyFactory = cacheKeyFactory;
    this.documentMapper = documentMapper;
    this.documentValidator = documentValidator;
    this.vectorizerService = vectorizerService;
    this.searchConfig = searchConfig;
    this.searchExecutor = searchExecutor;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Validates and stores a document in the index of its domain.
   *
   * @param domain the target collection; must match the document's type
   * @param document the document to store; not modified
   * @return the stored document, with its id (and, for messages, timestamp) assigned
   */
  @Timed(value = "search.index", description = "Time to index a document")
  public SearchDocument indexDocument(SearchDomain domain, SearchDocument document) {
    if (document == null) {
      throw new IllegalArgumentException("Document must not be null");
    }
    if (document.domain() != domain) {
      throw new IllegalArgumentException(
          "Cannot index " + document.domain().getTag() + " document into " + domain.getTag());
    }
    documentValidator.requireFields(document);

    SearchDocument stored =
        switch (domain) {
          case MESSAGES -> prepareMessage((ChatMessageDocument) document);
          case USERS -> prepareUser((UserDocument) document);
          case ROOMS -> prepareRoom((RoomDocument) document);
        };
    searchBackend.index(domain, stored.documentId(), documentMapper.toSource(stored));
    log.info("Indexed {} document {}", domain.getTag(), stored.documentId());
    meterRegistry.counter("search.documents.indexed", "domain", domain.getTag()).increment();
    return stored;
  }

  public ChatMessageDocument indexMessage(ChatMessageDocument message) {
    return (ChatMessageDocument) indexDocument(SearchDomain.MESSAGES, message);
  }

  public UserDocument indexUser(UserDocument user) {
    return (UserDocument) indexDocument(SearchDomain.USERS, user);
  }

  public RoomDocument indexRoom(RoomDocument room) {
    return (RoomDocument) indexDocument(SearchDomain.ROOMS, room);
  }

  private ChatMessageDocument prepareMessage(ChatMessageDocument message) {
    ChatMessageDocument.ChatMessageDocumentBuilder builder =
        message.toBuilder()
            .id(idOrRandom(message.getId()))
            .timestamp(clock.millis())
            .messageType(message.getMessageType() != null ? message.getMessageType() : "text")
            .relevanceScore(0.0);
    try {
      builder.contentVector(vectorizerService.vectorize(message.getContent()));
    } catch (VectorizationException e) {
      // still searchable lexically
      log.warn(
          "Indexing message without content vector ({}): {}", e.getReason(), e.getMessage());
      builder.contentVector(null);
    }
    return builder.build();
  }

  private UserDocument prepareUser(UserDocument user) {
    return user.toBuilder().userId(idOrRandom(user.getUserId())).relevanceScore(0.0).build();
  }

  private RoomDocument prepareRoom(RoomDocument room) {
    return room.toBuilder()
        .roomId(idOrRandom(room.getRoomId()))
        .description(room.getDescription() != null ? room.getDescription() : "")
        .relevanceScore(0.0)
        .build();
  }

  private static String idOrRandom(String id) {
    return id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
  }

  /**
   * Searches a domain, answering from the result cache when possible.
   *
   * @param domain the collection to search
   * @param intent what the caller wants to find
   * @param mode lexical or semantic matching
   * @return the documents in relevance (or, for lexical message search, recency) order
   */
  @Timed(value = "search.query", description = "Time to answer a search")
  public List<SearchDocument> search(SearchDomain domain, QueryIntent intent, SearchMode mode) {
    return search(domain, intent, mode, () -> false);
  }

  private List<SearchDocument> search(
      SearchDomain domain, QueryIntent intent, SearchMode mode, BooleanSupplier cancelled) {
    queryBuilder.validate(domain, intent, mode);
    String key = cacheKeyFactory.key(domain, mode, intent);

    Optional<List<SearchDocument>> cached = resultCache.get(key, domain);
    if (cached.isPresent()) {
      log.debug("[{}] {} answered from cache", domain.getTag(), mode);
      return cached.get();
    }

    StructuredRequest request = queryBuilder.build(domain, intent, mode);
    List<RawHit> hits = searchBackend.search(request);
    List<SearchDocument> results = normalize(domain, mode, hits);

    if (Thread.currentThread().isInterrupted() || cancelled.getAsBoolean()) {
      log.debug("[{}] search cancelled before cache write", domain.getTag());
      throw new CancellationException("Search cancelled");
    }
    resultCache.put(key, domain, results);
    log.debug("[{}] {} returned {} results", domain.getTag(), mode, results.size());
    return results;
  }

  private List<SearchDocument> normalize(SearchDomain domain, SearchMode mode, List<RawHit> hits) {
    List<SearchDocument> results = new ArrayList<>(hits.size());
    for (RawHit hit : hits) {
      SearchDocument document = documentMapper.fromHit(domain, hit);
      if (mode == SearchMode.SEMANTIC) {
        document.setRelevanceScore(Math.max(0.0, Math.min(2.0, document.getRelevanceScore())));
      }
      results.add(document);
    }
    return results;
  }

  /**
   * Runs {@link #search} on the search pool with the configured timeout.
   *
   * <p>Cancelling the returned future, or letting it time out, interrupts the worker. A cancelled
   * search never writes to the cache.
   */
  public CompletableFuture<List<SearchDocument>> searchAsync(
      SearchDomain domain, QueryIntent intent, SearchMode mode) {
    CompletableFuture<List<SearchDocument>> result = new CompletableFuture<>();
    Future<?> task =
        searchExecutor.submit(
            () -> {
              try {
                result.complete(search(domain, intent, mode, result::isDone));
              } catch (Throwable t) {
                result.completeExceptionally(t);
              }
            });
    long timeoutMillis = searchConfig.getAsync().getTimeout().toMillis();
    result.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
    result.whenComplete(
        (ignored, error) -> {
          Throwable cause = error instanceof CompletionException ? error.getCause() : error;
          if (cause instanceof CancellationException || cause instanceof TimeoutException) {
            if (cause instanceof TimeoutException) {
              log.warn("[{}] search timed out after {} ms", domain.getTag(), timeoutMillis);
              meterRegistry.counter("search.async.timeout", "domain", domain.getTag()).increment();
            }
            task.cancel(true);
          }
        });
    return result;
  }

  /** Lexical message search, newest first. */
  public List<ChatMessageDocument> searchMessages(String query, Map<String, Object> filters) {
    QueryIntent intent = QueryIntent.builder().query(query).filters(filters).build();
    return typed(
        search(SearchDomain.MESSAGES, intent, SearchMode.LEXICAL), ChatMessageDocument.class);
  }

  /** Semantic message search, most similar first. */
  public List<ChatMessageDocument> semanticSearch(String query, String context) {
    QueryIntent intent = QueryIntent.builder().query(query).context(context).build();
    return typed(
        search(SearchDomain.MESSAGES, intent, SearchMode.SEMANTIC), ChatMessageDocument.class);
  }

  /** Prefix search over usernames and emails, username matches ranked higher. */
  public List<UserDocument> searchUsers(String query) {
    return typed(
        search(SearchDomain.USERS, QueryIntent.of(query), SearchMode.LEXICAL), UserDocument.class);
  }

  /** Room search restricted to rooms the given user belongs to. */
  public List<RoomDocument> searchRooms(String query, String userId) {
    QueryIntent intent = QueryIntent.builder().query(query).requesterId(userId).build();
    return typed(search(SearchDomain.ROOMS, intent, SearchMode.LEXICAL), RoomDocument.class);
  }

  private static <T extends SearchDocument> List<T> typed(
      List<SearchDocument> documents, Class<T> type) {
    return documents.stream().map(type::cast).toList();
  }
}
