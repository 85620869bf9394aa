package com.flamingo.ai.chatsearch.service.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import com.flamingo.ai.chatsearch.elasticsearch.ChatMessageDocument;
import com.flamingo.ai.chatsearch.elasticsearch.RoomDocument;
import com.flamingo.ai.chatsearch.elasticsearch.SearchDocument;
import com.flamingo.ai.chatsearch.elasticsearch.UserDocument;
import com.flamingo.ai.chatsearch.exception.MalformedCacheEntryException;
import com.flamingo.ai.chatsearch.exception.MissingFieldException;
import com.flamingo.ai.chatsearch.service.search.DocumentValidator;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Serializes cached result sets as a versioned JSON envelope and decodes them strictly.
 *
 * <p>Envelope: {@code {"v":1,"domain":"messages","cachedAt":..,"expiresAt":..,"documents":[..]}}.
 * Decoding rejects unknown properties, a different version or domain, documents missing required
 * fields, and envelopes whose {@code expiresAt} has passed.
 */
@Component
public class ResultCodec {

  static final int VERSION = 1;
  private static final Set<String> ENVELOPE_FIELDS =
      Set.of("v", "domain", "cachedAt", "expiresAt", "documents");

  private final ObjectMapper objectMapper;
  private final DocumentValidator documentValidator;

  public ResultCodec(ObjectMapper objectMapper, DocumentValidator documentValidator) {
    this.objectMapper = objectMapper;
    this.documentValidator = documentValidator;
  }

  public String encode(
      SearchDomain domain, List<? extends SearchDocument> documents, Instant cachedAt, long ttl) {
    ObjectNode envelope = objectMapper.createObjectNode();
    envelope.put("v", VERSION);
    envelope.put("domain", domain.getTag());
    envelope.put("cachedAt", cachedAt.toEpochMilli());
    envelope.put("expiresAt", cachedAt.plusSeconds(ttl).toEpochMilli());
    ArrayNode array = envelope.putArray("documents");
    for (SearchDocument document : documents) {
      if (document.domain() != domain) {
        throw new IllegalArgumentException(
            "Cannot cache " + document.domain().getTag() + " document as " + domain.getTag());
      }
      array.add(objectMapper.valueToTree(document));
    }
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode cached result set", e);
    }
  }

  /**
   * Decodes and validates a cached payload.
   *
   * @param payload the stored text
   * @param expected the domain the caller is searching
   * @param now the current time, for expiry
   * @return the documents in their cached order
   * @throws MalformedCacheEntryException if the payload is not a valid, unexpired envelope
   */
  public List<SearchDocument> decode(String payload, SearchDomain expected, Instant now) {
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (IOException e) {
      throw new MalformedCacheEntryException("Cached payload is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedCacheEntryException("Cached payload is not a JSON object");
    }
    root.fieldNames()
        .forEachRemaining(
            field -> {
              if (!ENVELOPE_FIELDS.contains(field)) {
                throw new MalformedCacheEntryException("Unexpected envelope field: " + field);
              }
            });

    JsonNode version = root.get("v");
    if (version == null || !version.isInt() || version.intValue() != VERSION) {
      throw new MalformedCacheEntryException("Unsupported cache envelope version: " + version);
    }
    JsonNode domain = root.get("domain");
    if (domain == null || !domain.isTextual() || !expected.getTag().equals(domain.textValue())) {
      throw new MalformedCacheEntryException(
          "Cached domain " + domain + " does not match " + expected.getTag());
    }
    JsonNode expiresAt = root.get("expiresAt");
    if (expiresAt == null || !expiresAt.canConvertToLong()) {
      throw new MalformedCacheEntryException("Cache envelope has no expiry");
    }
    if (!now.isBefore(Instant.ofEpochMilli(expiresAt.longValue()))) {
      throw new MalformedCacheEntryException("Cache envelope expired at " + expiresAt.longValue());
    }
    JsonNode documents = root.get("documents");
    if (documents == null || !documents.isArray()) {
      throw new MalformedCacheEntryException("Cache envelope has no document array");
    }

    ObjectReader reader =
        objectMapper
            .readerFor(documentType(expected))
            .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .with(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    List<SearchDocument> results = new ArrayList<>(documents.size());
    for (JsonNode node : documents) {
      if (!node.isObject()) {
        throw new MalformedCacheEntryException("Cached document is not a JSON object");
      }
      SearchDocument document;
      try {
        document = reader.readValue(node);
      } catch (IOException e) {
        throw new MalformedCacheEntryException("Cached document failed to decode", e);
      }
      if (document.documentId() == null) {
        throw new MalformedCacheEntryException("Cached document has no id");
      }
      try {
        documentValidator.requireFields(document);
      } catch (MissingFieldException e) {
        throw new MalformedCacheEntryException("Cached document is incomplete", e);
      }
      results.add(document);
    }
    return results;
  }

  private static Class<? extends SearchDocument> documentType(SearchDomain domain) {
    return switch (domain) {
      case MESSAGES -> ChatMessageDocument.class;
      case USERS -> UserDocument.class;
      case ROOMS -> RoomDocument.class;
    };
  }
}
