package com.flamingo.ai.chatsearch.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chatsearch.domain.enums.SearchDomain;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

class GlobalExceptionHandlerTest {

  private SimpleMeterRegistry meterRegistry;
  private GlobalExceptionHandler handler;
  private MockHttpServletRequest request;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    handler = new GlobalExceptionHandler(meterRegistry);
    request = new MockHttpServletRequest("POST", "/api/search/messages");
  }

  @Test
  @DisplayName("Unvectorizable query text is a client error")
  void unvectorizableTextIsBadRequest() {
    ResponseEntity<ApiError> response =
        handler.handleVectorization(
            new VectorizationException(
                VectorizationException.Reason.NO_KNOWN_TERMS, "no known terms"),
            request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.INVALID_QUERY);
    assertThat(meterRegistry.counter("api_errors_total", "error_type", "invalid_query").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Backend outages hide internal details from the caller")
  void backendOutageUsesUserMessage() {
    BackendUnavailableException ex =
        new BackendUnavailableException(
            SearchDomain.USERS, "Connection refused: es-01:9200", new RuntimeException());

    ResponseEntity<ApiError> response = handler.handleBackendUnavailable(ex, request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().getMessage()).doesNotContain("es-01");
    assertThat(response.getBody().getPath()).isEqualTo("/api/search/messages");
    assertThat(response.getBody().getErrorId()).hasSize(8);
  }

  @Test
  @DisplayName("Generic search failures map to SEARCH_001")
  void searchFailure() {
    ResponseEntity<ApiError> response =
        handler.handleSearch(new SearchException("boom", new RuntimeException()), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.SEARCH_FAILED);
    assertThat(response.getBody().getMessage()).isEqualTo(SearchException.DEFAULT_USER_MESSAGE);
  }

  @Test
  @DisplayName("Unexpected errors are 500 without the exception message")
  void unexpectedError() {
    ResponseEntity<ApiError> response =
        handler.handleGeneric(new IllegalStateException("secret detail"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.INTERNAL_ERROR);
    assertThat(response.getBody().getMessage()).doesNotContain("secret");
  }
}
