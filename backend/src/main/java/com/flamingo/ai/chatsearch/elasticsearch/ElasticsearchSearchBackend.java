package com.flamingo.ai.chatsearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.chatsearch.config.SearchConfig;
import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import com.flamingo.ai.chatsearch.exception.BackendUnavailableException;
import com.flamingo.ai.chatsearch.service.search.SearchBackend;
import com.flamingo.ai.chatsearch.service.search.query.StructuredRequest;
import com.flamingo.ai.chatsearch.service.vectorizer.VectorizerService;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch implementation of the search backend for messages, users and rooms.
 *
 * <p>Creates or validates the three indices at startup, stores single documents, and executes
 * structured requests. Failures surface as {@link BackendUnavailableException}; no call is retried
 * here and no failure is turned into an empty result.
 */
@Service
@Slf4j
public class ElasticsearchSearchBackend implements SearchBackend {

  private final ElasticsearchClient elasticsearchClient;
  private final SearchRequestTranslator requestTranslator;
  private final VectorizerService vectorizerService;
  private final SearchConfig searchConfig;
  private final MeterRegistry meterRegistry;

  public ElasticsearchSearchBackend(
      ElasticsearchClient elasticsearchClient,
      SearchRequestTranslator requestTranslator,
      VectorizerService vectorizerService,
      SearchConfig searchConfig,
      MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.requestTranslator = requestTranslator;
    this.vectorizerService = vectorizerService;
    this.searchConfig = searchConfig;
    this.meterRegistry = meterRegistry;
  }

  @PostConstruct
  public void initIndices() {
    var indices = elasticsearchClient.indices();
    if (indices == null) {
      log.warn("Elasticsearch client not available, skipping index initialization");
      return;
    }
    for (SearchDomain domain : SearchDomain.values()) {
      initIndex(domain);
    }
  }

  void initIndex(SearchDomain domain) {
    String indexName = indexName(domain);
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
      if (!exists) {
        createIndex(domain);
        log.info("Created Elasticsearch index: {}", indexName);
      } else {
        updateAndValidateMappings(domain);
      }
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + indexName + "'", e);
    }
  }

  /**
   * Defines the index properties (schema) for a domain.
   *
   * @param domain the domain
   * @return a map of field names to Elasticsearch property definitions
   */
  Map<String, Property> defineIndexProperties(SearchDomain domain) {
    Map<String, Property> properties = new HashMap<>();
    switch (domain) {
      case MESSAGES -> {
        properties.put(IndexFields.CONTENT, Property.of(p -> p.text(TextProperty.of(t -> t))));
        properties.put(IndexFields.USER_ID, Property.of(p -> p.keyword(k -> k)));
        properties.put(IndexFields.ROOM_ID, Property.of(p -> p.keyword(k -> k)));
        properties.put(IndexFields.TIMESTAMP, Property.of(p -> p.long_(l -> l)));
        properties.put(IndexFields.MESSAGE_TYPE, Property.of(p -> p.keyword(k -> k)));
        int dims = vectorizerService.dimensions();
        // script_score reads the vector directly; no ANN structure is needed
        properties.put(
            IndexFields.CONTENT_VECTOR,
            Property.of(
                p -> p.denseVector(DenseVectorProperty.of(d -> d.dims(dims).index(false)))));
      }
      case USERS -> {
        properties.put(IndexFields.USER_ID, Property.of(p -> p.keyword(k -> k)));
        properties.put(IndexFields.USERNAME, Property.of(p -> p.text(TextProperty.of(t -> t))));
        properties.put(IndexFields.EMAIL, Property.of(p -> p.text(TextProperty.of(t -> t))));
      }
      case ROOMS -> {
        properties.put(IndexFields.ROOM_ID, Property.of(p -> p.keyword(k -> k)));
        properties.put(IndexFields.NAME, Property.of(p -> p.text(TextProperty.of(t -> t))));
        properties.put(
            IndexFields.DESCRIPTION, Property.of(p -> p.text(TextProperty.of(t -> t))));
        properties.put(IndexFields.MEMBERS, Property.of(p -> p.keyword(k -> k)));
      }
    }
    // metadata is kept in _source only; this layer enforces no schema on it
    properties.put(IndexFields.METADATA, Property.of(p -> p.object(o -> o.enabled(false))));
    return properties;
  }

  private void createIndex(SearchDomain domain) throws IOException {
    Map<String, Property> properties = defineIndexProperties(domain);
    // dynamic=false keeps caller-chosen metadata keys from growing the mapping
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(indexName(domain))
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches.
   *
   * <p>Elasticsearch allows adding new fields via the Put Mapping API but does not allow changing
   * the type of existing fields. Type mismatches, and a vector field whose dimensions differ from
   * the vectorizer's, fail startup so the index can be recreated.
   */
  private void updateAndValidateMappings(SearchDomain domain) throws IOException {
    String indexName = indexName(domain);
    Map<String, Property> expectedProperties = defineIndexProperties(domain);
    var response = elasticsearchClient.indices().getMapping(g -> g.index(indexName));
    var indexMapping = response.get(indexName);
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual == null) {
        missingFields.put(entry.getKey(), entry.getValue());
      } else if (entry.getValue()._kind() != actual._kind()) {
        String msg =
            String.format(
                "Mapping mismatch in index '%s': field '%s' expected type '%s' but found '%s'.",
                indexName, entry.getKey(), entry.getValue()._kind(), actual._kind());
        log.error(msg);
        mismatches.add(msg);
      } else if (entry.getValue().isDenseVector()) {
        Integer expectedDims = entry.getValue().denseVector().dims();
        Integer actualDims = actual.denseVector().dims();
        if (!Objects.equals(expectedDims, actualDims)) {
          String msg =
              String.format(
                  "Mapping mismatch in index '%s': field '%s' expected %s dims but found %s.",
                  indexName, entry.getKey(), expectedDims, actualDims);
          log.error(msg);
          mismatches.add(msg);
        }
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + indexName
              + "' has incompatible field type(s). Delete the index and restart. "
              + String.join("; ", mismatches));
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(indexName).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          indexName,
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", indexName);
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index a document")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "indexFallback")
  public void index(SearchDomain domain, String id, Map<String, Object> body) {
    String indexName = indexName(domain);
    try {
      elasticsearchClient.index(i -> i.index(indexName).id(id).document(body));
      log.debug("Indexed document {} to {}", id, indexName);
      meterRegistry.counter("search.backend.indexed", "domain", domain.getTag()).increment();
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to index document {} to {}: {}", id, indexName, e.getMessage(), e);
      meterRegistry.counter("search.backend.index.errors", "domain", domain.getTag()).increment();
      throw new BackendUnavailableException(domain, "Failed to index document " + id, e);
    }
  }

  @SuppressWarnings("unused")
  private void indexFallback(
      SearchDomain domain, String id, Map<String, Object> body, Throwable t) {
    throw asBackendUnavailable(domain, "Indexing unavailable", t);
  }

  @Override
  @Timed(value = "elasticsearch.search", description = "Time to execute a structured search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "searchFallback")
  @SuppressWarnings({"rawtypes", "unchecked"})
  public List<RawHit> search(StructuredRequest request) {
    String indexName = indexName(request.domain());
    SearchRequest searchRequest = requestTranslator.translate(request, indexName);
    try {
      SearchResponse<Map> response = elasticsearchClient.search(searchRequest, Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      List<RawHit> results = new ArrayList<>(hits.size());
      for (Hit<Map> hit : hits) {
        results.add(new RawHit(hit.id(), hit.score(), hit.source()));
      }
      log.debug(
          "[search] index={} vector={} filters={} returned={}",
          indexName,
          request.isVectorQuery(),
          request.filters().size(),
          results.size());
      meterRegistry
          .counter("search.backend.search", "domain", request.domain().getTag())
          .increment();
      return results;
    } catch (IOException | ElasticsearchException e) {
      log.error("Search failed for {}: {}", indexName, e.getMessage(), e);
      meterRegistry
          .counter("search.backend.search.errors", "domain", request.domain().getTag())
          .increment();
      throw new BackendUnavailableException(request.domain(), "Search failed on " + indexName, e);
    }
  }

  @SuppressWarnings("unused")
  private List<RawHit> searchFallback(StructuredRequest request, Throwable t) {
    throw asBackendUnavailable(request.domain(), "Search unavailable", t);
  }

  @Override
  public void refresh(SearchDomain domain) {
    String indexName = indexName(domain);
    try {
      elasticsearchClient.indices().refresh(r -> r.index(indexName));
      log.debug("Refreshed index {}", indexName);
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to refresh {}: {}", indexName, e.getMessage(), e);
      throw new BackendUnavailableException(domain, "Refresh failed on " + indexName, e);
    }
  }

  private BackendUnavailableException asBackendUnavailable(
      SearchDomain domain, String message, Throwable t) {
    if (t instanceof BackendUnavailableException backendUnavailable) {
      return backendUnavailable;
    }
    log.warn("{} search backend fallback triggered: {}", domain.getTag(), t.getMessage());
    meterRegistry.counter("search.backend.fallback", "domain", domain.getTag()).increment();
    return new BackendUnavailableException(domain, message + ": " + t.getMessage(), t);
  }

  public String indexName(SearchDomain domain) {
    return searchConfig.getIndices().nameFor(domain);
  }
}
