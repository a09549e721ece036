package com.github.spud.worksession.interfaces.rest;

import com.github.spud.worksession.domain.project.ProjectNotFoundException;
import com.github.spud.worksession.domain.session.SessionCreationFailedException;
import com.github.spud.worksession.domain.session.SessionNotFoundException;
import com.github.spud.worksession.domain.state.InvalidSessionTransitionException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Data
  @Builder
  public static class ErrorResponse {
    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("SESSION_NOT_FOUND")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .details(Map.of("sessionId", String.valueOf(e.getSessionId())))
        .build();
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
  }

  @ExceptionHandler(ProjectNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleProjectNotFound(ProjectNotFoundException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("PROJECT_NOT_FOUND")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
  }

  @ExceptionHandler(InvalidSessionTransitionException.class)
  public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidSessionTransitionException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("INVALID_TRANSITION")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .details(Map.of("from", e.getFrom().dbValue(), "transition", e.getTransition().name()))
        .build();
    return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
  }

  /**
   * The cause holds the store error and is only logged
   */
  @ExceptionHandler(SessionCreationFailedException.class)
  public ResponseEntity<ErrorResponse> handleCreationFailed(SessionCreationFailedException e) {
    log.error("Session creation failed", e);
    ErrorResponse error = ErrorResponse.builder()
        .code("SESSION_CREATION_FAILED")
        .message("Session could not be created")
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(error.getField(), error.getDefaultMessage());
    }

    ErrorResponse error = ErrorResponse.builder()
        .code("VALIDATION_ERROR")
        .message("Request validation failed")
        .timestamp(OffsetDateTime.now())
        .details(Map.of("fieldErrors", fieldErrors))
        .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("INVALID_ARGUMENT")
        .message(e.getReason())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("INVALID_ARGUMENT")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unhandled exception", e);
    ErrorResponse error = ErrorResponse.builder()
        .code("INTERNAL_ERROR")
        .message("An unexpected error occurred")
        .timestamp(OffsetDateTime.now())
        .details(Map.of("exception", e.getClass().getSimpleName()))
        .build();
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
  }
}
