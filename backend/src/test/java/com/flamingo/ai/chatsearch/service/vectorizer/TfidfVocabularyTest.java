package com.flamingo.ai.chatsearch.service.vectorizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TfidfVocabulary Tests")
class TfidfVocabularyTest {

  private static final List<String> CORPUS =
      List.of(
          "the build is failing on main",
          "the deploy finished",
          "build and deploy the search service",
          "lunch is here");

  @Nested
  @DisplayName("fit")
  class Fit {

    @Test
    @DisplayName("should keep every term when under the feature limit")
    void shouldKeepEveryTermWhenUnderLimit() {
      TfidfVocabulary vocabulary = TfidfVocabulary.fit(CORPUS, 100);

      assertThat(vocabulary.terms())
          .containsExactlyInAnyOrder(
              "the", "build", "is", "failing", "on", "main", "deploy", "finished", "and",
              "search", "service", "lunch", "here");
    }

    @Test
    @DisplayName("should keep the most frequent terms when over the feature limit")
    void shouldKeepMostFrequentTerms() {
      TfidfVocabulary vocabulary = TfidfVocabulary.fit(CORPUS, 2);

      // "the" occurs three times; "build", "deploy" and "is" twice, alphabetical tie-break
      assertThat(vocabulary.terms()).containsExactlyInAnyOrder("the", "build");
      assertThat(vocabulary.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should ignore single-character tokens and case")
    void shouldIgnoreSingleCharacterTokensAndCase() {
      TfidfVocabulary vocabulary = TfidfVocabulary.fit(List.of("A Cat, a HAT"), 10);

      assertThat(vocabulary.terms()).containsExactlyInAnyOrder("cat", "hat");
    }

    @Test
    @DisplayName("should reject a corpus without terms")
    void shouldRejectEmptyCorpus() {
      assertThatThrownBy(() -> TfidfVocabulary.fit(List.of("", "!", "a b"), 10))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject a non-positive feature limit")
    void shouldRejectNonPositiveFeatureLimit() {
      assertThatThrownBy(() -> TfidfVocabulary.fit(CORPUS, 0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("transform")
  class Transform {

    private final TfidfVocabulary vocabulary = TfidfVocabulary.fit(CORPUS, 100);

    @Test
    @DisplayName("should produce unit-length vectors of vocabulary size")
    void shouldProduceUnitLengthVectors() {
      float[] vector = vocabulary.transform("the build is failing");

      assertThat(vector).hasSize(vocabulary.size());
      double norm = 0;
      for (float value : vector) {
        norm += value * value;
      }
      assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
    }

    @Test
    @DisplayName("should produce a zero vector for unknown terms")
    void shouldProduceZeroVectorForUnknownTerms() {
      float[] vector = vocabulary.transform("completely unrelated words");

      for (float value : vector) {
        assertThat(value).isZero();
      }
    }

    @Test
    @DisplayName("should be deterministic across calls")
    void shouldBeDeterministic() {
      assertThat(vocabulary.transform("deploy the search service"))
          .containsExactly(vocabulary.transform("deploy the search service"));
    }

    @Test
    @DisplayName("should weight rare terms above common ones")
    void shouldWeightRareTermsAboveCommonOnes() {
      TfidfEmbeddingModel model = new TfidfEmbeddingModel(vocabulary);
      float[] vector = vocabulary.transform("the lunch");

      float common = 0;
      float rare = 0;
      List<String> terms = vocabulary.terms().stream().sorted().toList();
      for (int i = 0; i < terms.size(); i++) {
        if (terms.get(i).equals("the")) {
          common = vector[i];
        } else if (terms.get(i).equals("lunch")) {
          rare = vector[i];
        }
      }
      assertThat(model.dimension()).isEqualTo(terms.size());
      assertThat(rare).isGreaterThan(common);
    }
  }
}
