package com.flamingo.ai.chatsearch.service.vectorizer;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.Collection;
import java.util.List;

/**
 * {@link EmbeddingModel} backed by a TF-IDF vocabulary that is fit once and never refit.
 *
 * <p>Every vector lives in the same space, so cosine similarity between a query vector and a
 * stored document vector is meaningful across calls.
 */
public class TfidfEmbeddingModel implements EmbeddingModel {

  private final TfidfVocabulary vocabulary;

  public TfidfEmbeddingModel(TfidfVocabulary vocabulary) {
    this.vocabulary = vocabulary;
  }

  public static TfidfEmbeddingModel fit(Collection<String> corpus, int maxFeatures) {
    return new TfidfEmbeddingModel(TfidfVocabulary.fit(corpus, maxFeatures));
  }

  @Override
  public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
    List<Embedding> embeddings =
        textSegments.stream()
            .map(segment -> Embedding.from(vocabulary.transform(segment.text())))
            .toList();
    return Response.from(embeddings);
  }

  @Override
  public int dimension() {
    return vocabulary.size();
  }

  public TfidfVocabulary getVocabulary() {
    return vocabulary;
  }
}
