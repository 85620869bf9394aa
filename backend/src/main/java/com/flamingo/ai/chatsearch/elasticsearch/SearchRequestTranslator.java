package com.flamingo.ai.chatsearch.elasticsearch;

import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.chatsearch.service.search.query.FilterClause;
import com.flamingo.ai.chatsearch.service.search.query.MatchClause;
import com.flamingo.ai.chatsearch.service.search.query.SortSpec;
import com.flamingo.ai.chatsearch.service.search.query.StructuredRequest;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Translates a {@link StructuredRequest} into an Elasticsearch {@link SearchRequest}. */
@Component
@RequiredArgsConstructor
public class SearchRequestTranslator {

  static final String COSINE_SCRIPT =
      "cosineSimilarity(params.query_vector, '%s') + params.score_offset";

  private final ObjectMapper objectMapper;

  public SearchRequest translate(StructuredRequest request, String indexName) {
    Query query = request.isVectorQuery() ? vectorQuery(request) : lexicalQuery(request);
    return SearchRequest.of(
        s -> {
          s.index(indexName).query(query).size(request.size());
          if (!request.sort().isEmpty()) {
            // keep relevance scores on field-sorted hits
            s.trackScores(true);
          }
          for (SortSpec sort : request.sort()) {
            s.sort(
                so ->
                    so.field(
                        f ->
                            f.field(sort.field())
                                .order(
                                    sort.direction() == SortSpec.Direction.DESC
                                        ? SortOrder.Desc
                                        : SortOrder.Asc)));
          }
          return s;
        });
  }

  private Query lexicalQuery(StructuredRequest request) {
    List<Query> must = request.matches().stream().map(this::matchQuery).toList();
    List<Query> filter = termQueries(request.filters());
    return Query.of(q -> q.bool(b -> b.must(must).filter(filter)));
  }

  private Query matchQuery(MatchClause clause) {
    if (clause instanceof MatchClause.FieldMatch match) {
      return Query.of(q -> q.match(m -> m.field(match.field()).query(match.query())));
    }
    if (clause instanceof MatchClause.MultiFieldMatch multi) {
      List<String> fields =
          multi.fields().stream().map(MatchClause.BoostedField::toFieldSpec).toList();
      return Query.of(
          q ->
              q.multiMatch(
                  mm -> mm.query(multi.query()).fields(fields).type(TextQueryType.BoolPrefix)));
    }
    throw new IllegalArgumentException("Unsupported lexical clause: " + clause);
  }

  /**
   * Builds a script_score query over the documents that carry a vector and match the filters,
   * scored by the cosine similarity script. Documents indexed without a vector are skipped; the
   * script fails on them otherwise.
   */
  private Query vectorQuery(StructuredRequest request) {
    MatchClause.VectorSimilarity vector =
        request.matches().stream()
            .filter(MatchClause.VectorSimilarity.class::isInstance)
            .map(MatchClause.VectorSimilarity.class::cast)
            .findFirst()
            .orElseThrow();

    List<Map<String, Object>> filters = new ArrayList<>();
    filters.add(Map.of("exists", Map.of("field", vector.vectorField())));
    for (FilterClause filter : request.filters()) {
      filters.add(Map.of("term", Map.of(filter.field(), filter.value())));
    }
    Map<String, Object> inner = Map.of("bool", Map.of("filter", filters));

    Map<String, Object> params = new LinkedHashMap<>();
    params.put("query_vector", vector.queryVector());
    params.put("score_offset", vector.scoreOffset());

    Map<String, Object> script = new LinkedHashMap<>();
    script.put("source", String.format(COSINE_SCRIPT, vector.vectorField()));
    script.put("params", params);

    Map<String, Object> scriptScore = new LinkedHashMap<>();
    scriptScore.put("query", inner);
    scriptScore.put("script", script);

    String json;
    try {
      json = objectMapper.writeValueAsString(Map.of("script_score", scriptScore));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render script_score query", e);
    }
    return Query.of(q -> q.withJson(new StringReader(json)));
  }

  private static List<Query> termQueries(List<FilterClause> filters) {
    return filters.stream()
        .map(
            filter ->
                Query.of(
                    q -> q.term(t -> t.field(filter.field()).value(toFieldValue(filter.value())))))
        .toList();
  }

  static FieldValue toFieldValue(Object value) {
    if (value instanceof String s) {
      return FieldValue.of(s);
    }
    if (value instanceof Boolean b) {
      return FieldValue.of(b);
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      return FieldValue.of(((Number) value).longValue());
    }
    if (value instanceof Number n) {
      return FieldValue.of(n.doubleValue());
    }
    throw new IllegalArgumentException("Unsupported filter value: " + value);
  }
}
