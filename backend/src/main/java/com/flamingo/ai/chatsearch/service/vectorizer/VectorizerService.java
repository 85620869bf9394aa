package com.flamingo.ai.chatsearch.service.vectorizer;

import com.flamingo.ai.chatsearch.exception.VectorizationException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Service turning free text into fixed-length feature vectors for similarity queries. */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorizerService {

  private static final int MAX_CHARS_PER_VECTOR = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Vectorizes text with the deployment's fixed vectorizer.
   *
   * @param text the text to vectorize
   * @return the feature vector
   * @throws VectorizationException if the text is blank, the model fails, or the text has no known
   *     terms
   */
  @Timed(value = "vectorizer.vectorize", description = "Time to vectorize text")
  public List<Float> vectorize(String text) {
    if (text == null || text.isBlank()) {
      meterRegistry.counter("vectorizer.requests.failure", "reason", "blank").increment();
      throw new VectorizationException(
          VectorizationException.Reason.BLANK_TEXT, "Cannot vectorize blank text");
    }

    String input = text;
    if (input.length() > MAX_CHARS_PER_VECTOR) {
      log.warn(
          "Text too long for vectorizer, truncating from {} chars to {} chars",
          input.length(),
          MAX_CHARS_PER_VECTOR);
      input = input.substring(0, MAX_CHARS_PER_VECTOR);
    }

    Response<Embedding> response;
    try {
      response = embeddingModel.embed(input);
    } catch (RuntimeException e) {
      meterRegistry.counter("vectorizer.requests.failure", "reason", "model").increment();
      throw new VectorizationException(
          VectorizationException.Reason.MODEL_FAILURE, "Vectorizer failed: " + e.getMessage(), e);
    }

    float[] vector = response.content().vector();
    if (isZero(vector)) {
      meterRegistry.counter("vectorizer.requests.failure", "reason", "zero_vector").increment();
      throw new VectorizationException(
          VectorizationException.Reason.NO_KNOWN_TERMS,
          "Text has no terms known to the vectorizer");
    }

    meterRegistry.counter("vectorizer.requests.success").increment();
    return toFloatList(vector);
  }

  /** Returns the fixed dimensionality of vectors produced by this deployment. */
  public int dimensions() {
    return embeddingModel.dimension();
  }

  private static boolean isZero(float[] vector) {
    for (float f : vector) {
      if (f != 0.0f) {
        return false;
      }
    }
    return true;
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
