package com.linkshelf.refresh.api;

import com.linkshelf.refresh.service.LinkArchivedException;
import com.linkshelf.refresh.service.LinkNotFoundException;
import com.linkshelf.refresh.service.LinkRefreshInProgressException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RefreshExceptionHandler {

  @ExceptionHandler(LinkNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(LinkNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "link_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(LinkArchivedException.class)
  public ResponseEntity<Map<String, String>> handleArchived(LinkArchivedException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "link_archived", "message", ex.getMessage()));
  }

  @ExceptionHandler(LinkRefreshInProgressException.class)
  public ResponseEntity<Map<String, String>> handleInProgress(LinkRefreshInProgressException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "refresh_in_progress", "message", ex.getMessage()));
  }
}
