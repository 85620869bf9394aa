package com.flamingo.ai.chatsearch.service.search.query;

import com.flamingo.ai.chatsearch.config.SearchConfig;
import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import com.flamingo.ai.chatsearch.domain.enums.SearchMode;
import com.flamingo.ai.chatsearch.elasticsearch.IndexFields;
import com.flamingo.ai.chatsearch.exception.InvalidIntentException;
import com.flamingo.ai.chatsearch.exception.VectorizationException;
import com.flamingo.ai.chatsearch.service.vectorizer.VectorizerService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Translates a caller's {@link QueryIntent} into a {@link StructuredRequest}.
 *
 * <p>Filters always become term-level clauses in field-name order. Room search always carries a
 * membership filter on the requester, which caller filters cannot replace. Apart from the single
 * vectorizer call of a semantic build, building is pure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryBuilder {

  /** Shifts cosine similarity from [-1, 1] to the non-negative range [0, 2]. */
  public static final double COSINE_SCORE_OFFSET = 1.0;

  static final double USERNAME_BOOST = 2.0;
  static final double EMAIL_BOOST = 1.0;

  private final VectorizerService vectorizerService;
  private final SearchConfig searchConfig;

  /**
   * Builds the structured request for a search.
   *
   * @param domain the collection to search
   * @param intent what the caller wants to find
   * @param mode lexical or semantic matching
   * @return the structured request
   * @throws InvalidIntentException if the intent is malformed for the domain and mode
   */
  public StructuredRequest build(SearchDomain domain, QueryIntent intent, SearchMode mode) {
    validate(domain, intent, mode);

    if (mode == SearchMode.SEMANTIC) {
      return buildSemantic(intent);
    }
    return switch (domain) {
      case MESSAGES -> buildMessageSearch(intent);
      case USERS -> buildUserSearch(intent);
      case ROOMS -> buildRoomSearch(intent);
    };
  }

  private StructuredRequest buildMessageSearch(QueryIntent intent) {
    return new StructuredRequest(
        SearchDomain.MESSAGES,
        List.of(new MatchClause.FieldMatch(IndexFields.CONTENT, intent.query())),
        termFilters(intent.filters()),
        List.of(SortSpec.desc(IndexFields.TIMESTAMP)),
        lexicalSize(intent));
  }

  private StructuredRequest buildUserSearch(QueryIntent intent) {
    MatchClause match =
        new MatchClause.MultiFieldMatch(
            List.of(
                new MatchClause.BoostedField(IndexFields.USERNAME, USERNAME_BOOST),
                new MatchClause.BoostedField(IndexFields.EMAIL, EMAIL_BOOST)),
            intent.query());
    return new StructuredRequest(
        SearchDomain.USERS,
        List.of(match),
        termFilters(intent.filters()),
        List.of(),
        lexicalSize(intent));
  }

  private StructuredRequest buildRoomSearch(QueryIntent intent) {
    Map<String, Object> callerFilters = new TreeMap<>(intent.filters());
    if (callerFilters.remove(IndexFields.MEMBERS) != null) {
      log.debug("Ignoring caller-supplied members filter for requester {}", intent.requesterId());
    }
    List<FilterClause> filters = new ArrayList<>();
    filters.add(new FilterClause(IndexFields.MEMBERS, intent.requesterId()));
    filters.addAll(termFilters(callerFilters));
    return new StructuredRequest(
        SearchDomain.ROOMS,
        List.of(new MatchClause.FieldMatch(IndexFields.NAME, intent.query())),
        filters,
        List.of(),
        lexicalSize(intent));
  }

  private StructuredRequest buildSemantic(QueryIntent intent) {
    List<Float> queryVector;
    try {
      queryVector = vectorizerService.vectorize(semanticText(intent));
    } catch (VectorizationException e) {
      if (e.isInputError()) {
        throw new InvalidIntentException(
            "Semantic context cannot be vectorized: " + e.getMessage());
      }
      throw e;
    }
    return new StructuredRequest(
        SearchDomain.MESSAGES,
        List.of(
            new MatchClause.VectorSimilarity(
                IndexFields.CONTENT_VECTOR, queryVector, COSINE_SCORE_OFFSET)),
        termFilters(intent.filters()),
        List.of(),
        intent.limit() != null ? intent.limit() : searchConfig.getLimits().getSemanticDefault());
  }

  /** The text vectorized for a semantic query: the query (when given) followed by the context. */
  static String semanticText(QueryIntent intent) {
    if (intent.query().isBlank()) {
      return intent.context();
    }
    return intent.query() + " " + intent.context();
  }

  private int lexicalSize(QueryIntent intent) {
    return intent.limit() != null ? intent.limit() : searchConfig.getLimits().getLexicalDefault();
  }

  private static List<FilterClause> termFilters(Map<String, Object> filters) {
    return new TreeMap<>(filters)
        .entrySet().stream()
            .map(e -> new FilterClause(e.getKey(), e.getValue()))
            .toList();
  }

  /**
   * Checks an intent without building it. Performs no I/O.
   *
   * @throws InvalidIntentException if the intent is malformed for the domain and mode
   */
  public void validate(SearchDomain domain, QueryIntent intent, SearchMode mode) {
    if (domain == null || mode == null) {
      throw new InvalidIntentException("Search domain and mode are required");
    }
    if (intent == null) {
      throw new InvalidIntentException("Query intent is required");
    }
    if (intent.query().isBlank() && !intent.hasContext()) {
      throw new InvalidIntentException("Query and semantic context cannot both be empty");
    }
    if (intent.limit() != null) {
      if (intent.limit() <= 0) {
        throw new InvalidIntentException("Limit must be positive, got " + intent.limit());
      }
      int maxSize = searchConfig.getLimits().getMaxSize();
      if (intent.limit() > maxSize) {
        throw new InvalidIntentException(
            "Limit must not exceed " + maxSize + ", got " + intent.limit());
      }
    }
    for (Map.Entry<String, Object> filter : intent.filters().entrySet()) {
      if (filter.getKey() == null || filter.getKey().isBlank()) {
        throw new InvalidIntentException("Filter field names must not be blank");
      }
      if (!isScalar(filter.getValue())) {
        throw new InvalidIntentException(
            "Filter '" + filter.getKey() + "' must be a string, number or boolean");
      }
    }

    if (mode == SearchMode.SEMANTIC) {
      if (domain != SearchDomain.MESSAGES) {
        throw new InvalidIntentException(
            "Semantic search is only supported for messages, not " + domain.getTag());
      }
      if (!intent.hasContext()) {
        throw new InvalidIntentException("Semantic search requires a context");
      }
      return;
    }

    if (intent.query().isBlank()) {
      throw new InvalidIntentException("Lexical search requires a query");
    }
    if (domain == SearchDomain.ROOMS
        && (intent.requesterId() == null || intent.requesterId().isBlank())) {
      throw new InvalidIntentException("Room search requires the requesting user's id");
    }
  }

  private static boolean isScalar(Object value) {
    return value instanceof String || value instanceof Number || value instanceof Boolean;
  }
}
