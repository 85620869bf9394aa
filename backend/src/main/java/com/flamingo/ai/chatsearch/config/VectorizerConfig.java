package com.flamingo.ai.chatsearch.config;

import com.flamingo.ai.chatsearch.service.vectorizer.TfidfEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Configuration for the vectorizer behind semantic search.
 *
 * <p>The TF-IDF provider fits its vocabulary once here, at startup, over the configured corpus.
 */
@Configuration
@Slf4j
public class VectorizerConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Bean
  public EmbeddingModel embeddingModel(SearchConfig searchConfig, ResourceLoader resourceLoader) {
    SearchConfig.Vectorizer vectorizer = searchConfig.getVectorizer();
    return switch (vectorizer.getProvider()) {
      case "tfidf" -> tfidfModel(vectorizer, resourceLoader);
      case "openai" -> openAiModel(vectorizer);
      default ->
          throw new IllegalStateException(
              "Unknown vectorizer provider: " + vectorizer.getProvider());
    };
  }

  private EmbeddingModel tfidfModel(
      SearchConfig.Vectorizer vectorizer, ResourceLoader resourceLoader) {
    List<String> corpus = readCorpus(resourceLoader.getResource(vectorizer.getCorpusLocation()));
    TfidfEmbeddingModel model = TfidfEmbeddingModel.fit(corpus, vectorizer.getMaxFeatures());
    log.info(
        "Fitted TF-IDF vectorizer on {} corpus lines from {}: {} features",
        corpus.size(),
        vectorizer.getCorpusLocation(),
        model.dimension());
    return model;
  }

  private EmbeddingModel openAiModel(SearchConfig.Vectorizer vectorizer) {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required for the openai vectorizer. Set OPENAI_API_KEY.");
    }
    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(vectorizer.getDimensions())
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  private List<String> readCorpus(Resource resource) {
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
      return reader.lines().filter(line -> !line.isBlank()).toList();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read vectorizer corpus from " + resource, e);
    }
  }
}
