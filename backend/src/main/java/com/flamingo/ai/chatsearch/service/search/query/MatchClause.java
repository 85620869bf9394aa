package com.flamingo.ai.chatsearch.service.search.query;

import java.util.List;

/** A scoring clause of a {@link StructuredRequest}. */
public interface MatchClause {

  /** Full-text match of the query against one analyzed field. */
  record FieldMatch(String field, String query) implements MatchClause {}

  /** Prefix-aware full-text match against several fields, each with its own boost. */
  record MultiFieldMatch(List<BoostedField> fields, String query) implements MatchClause {

    public MultiFieldMatch {
      fields = List.copyOf(fields);
    }
  }

  /**
   * Scores every candidate by {@code cosineSimilarity(queryVector, vectorField) + scoreOffset}.
   */
  record VectorSimilarity(String vectorField, List<Float> queryVector, double scoreOffset)
      implements MatchClause {

    public VectorSimilarity {
      queryVector = List.copyOf(queryVector);
    }
  }

  record BoostedField(String field, double boost) {

    /** Renders the field in Elasticsearch's {@code field^boost} notation. */
    public String toFieldSpec() {
      return field + "^" + boost;
    }
  }
}
