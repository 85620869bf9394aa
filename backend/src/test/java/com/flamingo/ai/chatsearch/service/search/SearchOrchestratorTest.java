package com.flamingo.ai.chatsearch.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chatsearch.api.dto.request.IndexRoomRequest;
import com.flamingo.ai.chatsearch.config.SearchConfig;
import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import com.flamingo.ai.chatsearch.domain.enums.SearchMode;
import com.flamingo.ai.chatsearch.elasticsearch.ChatMessageDocument;
import com.flamingo.ai.chatsearch.elasticsearch.DocumentMapper;
import com.flamingo.ai.chatsearch.elasticsearch.IndexFields;
import com.flamingo.ai.chatsearch.elasticsearch.RoomDocument;
import com.flamingo.ai.chatsearch.elasticsearch.SearchDocument;
import com.flamingo.ai.chatsearch.elasticsearch.UserDocument;
import com.flamingo.ai.chatsearch.exception.InvalidIntentException;
import com.flamingo.ai.chatsearch.exception.MissingFieldException;
import com.flamingo.ai.chatsearch.exception.VectorizationException;
import com.flamingo.ai.chatsearch.service.search.SearchBackend.RawHit;
import com.flamingo.ai.chatsearch.service.search.cache.CacheKeyFactory;
import com.flamingo.ai.chatsearch.service.search.cache.SearchResultCache;
import com.flamingo.ai.chatsearch.service.search.query.QueryBuilder;
import com.flamingo.ai.chatsearch.service.search.query.QueryIntent;
import com.flamingo.ai.chatsearch.service.search.query.StructuredRequest;
import com.flamingo.ai.chatsearch.service.vectorizer.VectorizerService;
import com.flamingo.ai.chatsearch.support.MutableClock;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;

@ExtendWith(MockitoExtension.class)
class SearchOrchestratorTest {

  private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");

  @Mock private SearchBackend searchBackend;
  @Mock private QueryBuilder queryBuilder;
  @Mock private SearchResultCache resultCache;
  @Mock private CacheKeyFactory cacheKeyFactory;
  @Mock private VectorizerService vectorizerService;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private SearchOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);
    orchestrator =
        new SearchOrchestrator(
            searchBackend,
            queryBuilder,
            resultCache,
            cacheKeyFactory,
            new DocumentMapper(),
            new DocumentValidator(),
            vectorizerService,
            new SearchConfig(),
            new TaskExecutorAdapter(new SyncTaskExecutor()),
            meterRegistry,
            new MutableClock(NOW));
  }

  @Nested
  @DisplayName("indexDocument")
  class IndexDocument {

    @Test
    @DisplayName("should assign id, timestamp and vector to a new message")
    @SuppressWarnings("unchecked")
    void shouldPrepareMessage() {
      when(vectorizerService.vectorize("hello")).thenReturn(List.of(0.6f, 0.8f));

      ChatMessageDocument stored =
          orchestrator.indexMessage(
              ChatMessageDocument.builder().content("hello").userId("u1").roomId("r1").build());

      assertThat(stored.getId()).isNotBlank();
      assertThat(stored.getTimestamp()).isEqualTo(NOW.toEpochMilli());
      assertThat(stored.getMessageType()).isEqualTo("text");
      ArgumentCaptor<Map<String, Object>> body = ArgumentCaptor.forClass(Map.class);
      verify(searchBackend).index(eq(SearchDomain.MESSAGES), eq(stored.getId()), body.capture());
      assertThat(body.getValue())
          .containsEntry(IndexFields.CONTENT, "hello")
          .containsEntry(IndexFields.TIMESTAMP, NOW.toEpochMilli())
          .containsEntry(IndexFields.CONTENT_VECTOR, List.of(0.6f, 0.8f));
      verify(meterRegistry).counter("search.documents.indexed", "domain", "messages");
    }

    @Test
    @DisplayName("should index a message without a vector when vectorization fails")
    @SuppressWarnings("unchecked")
    void shouldIndexWithoutVector() {
      when(vectorizerService.vectorize("qq zz"))
          .thenThrow(
              new VectorizationException(
                  VectorizationException.Reason.NO_KNOWN_TERMS, "no known terms"));

      orchestrator.indexMessage(
          ChatMessageDocument.builder()
              .id("m-1")
              .content("qq zz")
              .userId("u1")
              .roomId("r1")
              .build());

      ArgumentCaptor<Map<String, Object>> body = ArgumentCaptor.forClass(Map.class);
      verify(searchBackend).index(eq(SearchDomain.MESSAGES), eq("m-1"), body.capture());
      assertThat(body.getValue()).doesNotContainKey(IndexFields.CONTENT_VECTOR);
    }

    @Test
    @DisplayName("should reject a document with a missing field before any backend call")
    void shouldRejectMissingField() {
      UserDocument user = UserDocument.builder().username("anna").build();

      assertThatThrownBy(() -> orchestrator.indexUser(user))
          .isInstanceOf(MissingFieldException.class)
          .extracting("field")
          .isEqualTo(IndexFields.EMAIL);

      verifyNoInteractions(searchBackend);
    }

    @Test
    @DisplayName("should reject a room with no members")
    void shouldRejectRoomWithoutMembers() {
      RoomDocument room = RoomDocument.builder().name("general").members(Set.of()).build();

      assertThatThrownBy(() -> orchestrator.indexRoom(room))
          .isInstanceOf(MissingFieldException.class);
      verifyNoInteractions(searchBackend);
    }

    @Test
    @DisplayName("should reject a room whose members include a null or blank id")
    void shouldRejectRoomWithNullMember() {
      RoomDocument withNull =
          IndexRoomRequest.builder()
              .name("general")
              .members(new LinkedHashSet<>(Arrays.asList("u1", null)))
              .build()
              .toDocument();
      RoomDocument withBlank =
          RoomDocument.builder().name("general").members(Set.of("u1", " ")).build();

      assertThatThrownBy(() -> orchestrator.indexRoom(withNull))
          .isInstanceOf(MissingFieldException.class)
          .extracting("field")
          .isEqualTo(IndexFields.MEMBERS);
      assertThatThrownBy(() -> orchestrator.indexRoom(withBlank))
          .isInstanceOf(MissingFieldException.class);
      verifyNoInteractions(searchBackend);
    }

    @Test
    @DisplayName("should reject a document of another domain")
    void shouldRejectDomainMismatch() {
      UserDocument user = UserDocument.builder().username("anna").email("a@x.com").build();

      assertThatThrownBy(() -> orchestrator.indexDocument(SearchDomain.ROOMS, user))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(searchBackend);
    }

    @Test
    @DisplayName("should default a room description to empty")
    void shouldDefaultRoomDescription() {
      RoomDocument stored =
          orchestrator.indexRoom(
              RoomDocument.builder().roomId("r1").name("general").members(Set.of("u1")).build());

      assertThat(stored.getRoomId()).isEqualTo("r1");
      assertThat(stored.getDescription()).isEmpty();
    }
  }

  @Nested
  @DisplayName("search")
  class Search {

    private final QueryIntent intent = QueryIntent.of("hello");

    @BeforeEach
    void stubKey() {
      lenient()
          .when(cacheKeyFactory.key(any(), any(), any()))
          .thenReturn("search:messages:abc");
    }

    @Test
    @DisplayName("should answer a cache hit without building or dispatching")
    void shouldAnswerFromCache() {
      List<SearchDocument> cached =
          List.of(ChatMessageDocument.builder().id("m-1").content("hello").build());
      when(resultCache.get("search:messages:abc", SearchDomain.MESSAGES))
          .thenReturn(Optional.of(cached));

      List<SearchDocument> results =
          orchestrator.search(SearchDomain.MESSAGES, intent, SearchMode.LEXICAL);

      assertThat(results).isSameAs(cached);
      verify(queryBuilder, never()).build(any(), any(), any());
      verifyNoInteractions(searchBackend);
    }

    @Test
    @DisplayName("should dispatch once on a miss and cache the normalized results")
    void shouldDispatchAndCacheOnMiss() {
      StructuredRequest request =
          new StructuredRequest(SearchDomain.MESSAGES, List.of(), List.of(), List.of(), 10);
      when(resultCache.get("search:messages:abc", SearchDomain.MESSAGES))
          .thenReturn(Optional.empty());
      when(queryBuilder.build(SearchDomain.MESSAGES, intent, SearchMode.LEXICAL))
          .thenReturn(request);
      when(searchBackend.search(request))
          .thenReturn(
              List.of(new RawHit("m-1", 1.2, Map.of(IndexFields.CONTENT, "hello world"))));

      List<SearchDocument> results =
          orchestrator.search(SearchDomain.MESSAGES, intent, SearchMode.LEXICAL);

      assertThat(results).hasSize(1);
      assertThat(results.get(0).documentId()).isEqualTo("m-1");
      assertThat(results.get(0).getRelevanceScore()).isEqualTo(1.2);
      verify(searchBackend).search(request);
      verify(resultCache).put("search:messages:abc", SearchDomain.MESSAGES, results);
    }

    @Test
    @DisplayName("should clamp semantic scores into [0, 2]")
    void shouldClampSemanticScores() {
      QueryIntent semantic = QueryIntent.builder().query("").context("deploy").build();
      StructuredRequest request =
          new StructuredRequest(SearchDomain.MESSAGES, List.of(), List.of(), List.of(), 10);
      when(resultCache.get(anyString(), eq(SearchDomain.MESSAGES))).thenReturn(Optional.empty());
      when(queryBuilder.build(SearchDomain.MESSAGES, semantic, SearchMode.SEMANTIC))
          .thenReturn(request);
      when(searchBackend.search(request))
          .thenReturn(
              List.of(
                  new RawHit("m-1", 2.0000001, Map.of()), new RawHit("m-2", -0.0000001, Map.of())));

      List<SearchDocument> results =
          orchestrator.search(SearchDomain.MESSAGES, semantic, SearchMode.SEMANTIC);

      assertThat(results)
          .extracting(SearchDocument::getRelevanceScore)
          .containsExactly(2.0, 0.0);
    }

    @Test
    @DisplayName("should validate before touching the cache")
    void shouldValidateFirst() {
      QueryIntent blank = QueryIntent.of("   ");
      doThrow(new InvalidIntentException("Lexical search requires a query"))
          .when(queryBuilder)
          .validate(SearchDomain.USERS, blank, SearchMode.LEXICAL);

      assertThatThrownBy(() -> orchestrator.search(SearchDomain.USERS, blank, SearchMode.LEXICAL))
          .isInstanceOf(InvalidIntentException.class);

      verifyNoInteractions(resultCache, searchBackend);
    }

    @Test
    @DisplayName("should not cache when the backend fails")
    void shouldNotCacheFailures() {
      StructuredRequest request =
          new StructuredRequest(SearchDomain.MESSAGES, List.of(), List.of(), List.of(), 10);
      when(resultCache.get(anyString(), eq(SearchDomain.MESSAGES))).thenReturn(Optional.empty());
      when(queryBuilder.build(any(), any(), any())).thenReturn(request);
      when(searchBackend.search(request)).thenThrow(new IllegalStateException("boom"));

      assertThatThrownBy(
              () -> orchestrator.search(SearchDomain.MESSAGES, intent, SearchMode.LEXICAL))
          .isInstanceOf(IllegalStateException.class);

      verify(resultCache, never()).put(anyString(), any(), any());
    }
  }
}
