package com.flamingo.ai.chatsearch.service.vectorizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chatsearch.exception.VectorizationException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("VectorizerService Tests")
class VectorizerServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private VectorizerService vectorizerService;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);

    vectorizerService = new VectorizerService(embeddingModel, meterRegistry);
  }

  @Test
  @DisplayName("Should return the model's vector as floats")
  void shouldReturnVector() {
    when(embeddingModel.embed(anyString())).thenReturn(response(0.6f, 0.0f, 0.8f));

    List<Float> result = vectorizerService.vectorize("deploy finished");

    assertThat(result).containsExactly(0.6f, 0.0f, 0.8f);
    verify(meterRegistry.counter("vectorizer.requests.success")).increment();
  }

  @Test
  @DisplayName("Should reject blank text without calling the model")
  void shouldRejectBlankText() {
    assertThatThrownBy(() -> vectorizerService.vectorize("   "))
        .isInstanceOf(VectorizationException.class)
        .satisfies(
            e ->
                assertThat(((VectorizationException) e).getReason())
                    .isEqualTo(VectorizationException.Reason.BLANK_TEXT));
    verify(embeddingModel, never()).embed(anyString());
  }

  @Test
  @DisplayName("Should report text without known terms as an input error")
  void shouldRejectZeroVector() {
    when(embeddingModel.embed(anyString())).thenReturn(response(0f, 0f, 0f));

    assertThatThrownBy(() -> vectorizerService.vectorize("zzzz qqqq"))
        .isInstanceOf(VectorizationException.class)
        .satisfies(
            e -> {
              VectorizationException ve = (VectorizationException) e;
              assertThat(ve.getReason()).isEqualTo(VectorizationException.Reason.NO_KNOWN_TERMS);
              assertThat(ve.isInputError()).isTrue();
            });
  }

  @Test
  @DisplayName("Should wrap model failures")
  void shouldWrapModelFailures() {
    when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("connection reset"));

    assertThatThrownBy(() -> vectorizerService.vectorize("hello"))
        .isInstanceOf(VectorizationException.class)
        .hasMessageContaining("connection reset")
        .satisfies(e -> assertThat(((VectorizationException) e).isInputError()).isFalse());
    verify(meterRegistry.counter("vectorizer.requests.failure", "reason", "model")).increment();
  }

  @Test
  @DisplayName("Should truncate very long text")
  void shouldTruncateVeryLongText() {
    when(embeddingModel.embed(anyString())).thenReturn(response(1.0f));

    vectorizerService.vectorize("word ".repeat(2000));

    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(captor.capture());
    assertThat(captor.getValue()).hasSize(5000);
  }

  @Test
  @DisplayName("Should expose the model's dimensionality")
  void shouldExposeDimensions() {
    when(embeddingModel.dimension()).thenReturn(384);

    assertThat(vectorizerService.dimensions()).isEqualTo(384);
  }

  private static Response<Embedding> response(float... vector) {
    return Response.from(Embedding.from(vector));
  }
}
