package com.flamingo.ai.chatsearch.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidIntentException.class)
  public ResponseEntity<ApiError> handleInvalidIntent(
      InvalidIntentException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_query");
    String errorId = generateErrorId();
    log.warn("Invalid query [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        ApiError.builder()
            .errorId(errorId)
            .code(ApiError.INVALID_QUERY)
            .message(ex.getMessage()),
        request);
  }

  @ExceptionHandler(MissingFieldException.class)
  public ResponseEntity<ApiError> handleMissingField(
      MissingFieldException ex, HttpServletRequest request) {

    incrementErrorCounter("missing_field");
    String errorId = generateErrorId();
    log.warn(
        "Rejected {} document [{}]: missing {}",
        ex.getDomain().getTag(),
        errorId,
        ex.getField());

    return respond(
        HttpStatus.BAD_REQUEST,
        ApiError.builder()
            .errorId(errorId)
            .code(ApiError.MISSING_FIELD)
            .message(ex.getMessage())
            .field(ex.getField()),
        request);
  }

  @ExceptionHandler(BackendUnavailableException.class)
  public ResponseEntity<ApiError> handleBackendUnavailable(
      BackendUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("backend_unavailable");
    String errorId = generateErrorId();
    log.error(
        "Search backend unavailable for {} [{}]: {}",
        ex.getDomain().getTag(),
        errorId,
        ex.getMessage(),
        ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.builder()
            .errorId(errorId)
            .code(ApiError.BACKEND_UNAVAILABLE)
            .message(ex.getUserMessage()),
        request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {

    incrementErrorCounter("search_error");
    String errorId = generateErrorId();
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.builder()
            .errorId(errorId)
            .code(ApiError.SEARCH_FAILED)
            .message(ex.getUserMessage()),
        request);
  }

  @ExceptionHandler(VectorizationException.class)
  public ResponseEntity<ApiError> handleVectorization(
      VectorizationException ex, HttpServletRequest request) {

    String errorId = generateErrorId();
    if (ex.isInputError()) {
      incrementErrorCounter("invalid_query");
      log.warn("Unvectorizable text [{}]: {}", errorId, ex.getMessage());
      return respond(
          HttpStatus.BAD_REQUEST,
          ApiError.builder()
              .errorId(errorId)
              .code(ApiError.INVALID_QUERY)
              .message(ex.getMessage()),
          request);
    }

    incrementErrorCounter("vectorizer_error");
    log.error("Vectorizer error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.builder()
            .errorId(errorId)
            .code(ApiError.VECTORIZER_UNAVAILABLE)
            .message("Semantic search is temporarily unavailable. Please try again."),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(
        HttpStatus.BAD_REQUEST,
        ApiError.builder().errorId(errorId).code(ApiError.VALIDATION_ERROR).message(message),
        request);
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiError> handleUnreadableRequest(
      Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request [{}]: {}", errorId, ex.getMessage());

    String message =
        ex instanceof MissingServletRequestParameterException missing
            ? "Missing request parameter '" + missing.getParameterName() + "'"
            : "Malformed request body";
    return respond(
        HttpStatus.BAD_REQUEST,
        ApiError.builder().errorId(errorId).code(ApiError.VALIDATION_ERROR).message(message),
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.builder()
            .errorId(errorId)
            .code(ApiError.INTERNAL_ERROR)
            .message("An unexpected error occurred. Please try again later."),
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status, ApiError.ApiErrorBuilder error, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(error.path(request.getRequestURI()).timestamp(Instant.now()).build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
