package com.boardwatch.watch.api;

import com.boardwatch.watch.board.FetchException;
import com.boardwatch.watch.service.ConfigurationNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class WatchExceptionHandler {

  @ExceptionHandler(ConfigurationNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(ConfigurationNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "configuration_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }

  // Retryable fetch failures are upstream problems; the rest are bad board ids or counts.
  @ExceptionHandler(FetchException.class)
  public ResponseEntity<Map<String, String>> handleFetch(FetchException ex) {
    HttpStatus status = ex.isRetryable() ? HttpStatus.BAD_GATEWAY : HttpStatus.BAD_REQUEST;
    return ResponseEntity.status(status)
        .body(Map.of("error", "board_fetch_failed", "message", String.valueOf(ex.getMessage())));
  }
}
