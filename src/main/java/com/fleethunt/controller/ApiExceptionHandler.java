package com.fleethunt.controller;

import com.fleethunt.exception.AuthorizationException;
import com.fleethunt.exception.HuntNotFoundException;
import com.fleethunt.exception.InvalidHuntStateException;
import com.fleethunt.exception.ValidationException;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

/** Maps hunt exceptions to JSON error payloads. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ErrorPayload> handleValidation(ValidationException ex, WebRequest request) {
    return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class,
      HttpMessageNotReadableException.class, MissingRequestHeaderException.class})
  public ResponseEntity<ErrorPayload> handleBadRequest(Exception ex, WebRequest request) {
    log.debug("Rejected malformed request: {}", ex.getMessage());
    return build(HttpStatus.BAD_REQUEST, "Validation failed", request);
  }

  @ExceptionHandler(AuthorizationException.class)
  public ResponseEntity<ErrorPayload> handleAuthorization(AuthorizationException ex,
                                                          WebRequest request) {
    return build(HttpStatus.FORBIDDEN, "approval required: " + ex.getMessage(), request);
  }

  @ExceptionHandler(HuntNotFoundException.class)
  public ResponseEntity<ErrorPayload> handleNotFound(HuntNotFoundException ex, WebRequest request) {
    return build(HttpStatus.NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(InvalidHuntStateException.class)
  public ResponseEntity<ErrorPayload> handleInvalidState(InvalidHuntStateException ex,
                                                         WebRequest request) {
    return build(HttpStatus.CONFLICT, ex.getMessage(), request);
  }

  private ResponseEntity<ErrorPayload> build(HttpStatus status, String message, WebRequest request) {
    String path = null;
    if (request instanceof ServletWebRequest servletRequest) {
      path = servletRequest.getRequest().getRequestURI();
    }
    ErrorPayload body = new ErrorPayload(
        Instant.now(), status.value(), status.getReasonPhrase(), message, path);
    return ResponseEntity.status(status).body(body);
  }
}
