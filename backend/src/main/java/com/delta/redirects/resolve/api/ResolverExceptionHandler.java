package com.delta.redirects.resolve.api;

import com.delta.redirects.resolve.service.ActiveResolutionRunException;
import com.delta.redirects.resolve.service.SourceFileException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ResolverExceptionHandler {

  @ExceptionHandler(ActiveResolutionRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveResolutionRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_resolution_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadArgument(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_argument", "message", ex.getMessage()));
  }

  @ExceptionHandler(SourceFileException.class)
  public ResponseEntity<Map<String, String>> handleSourceFile(SourceFileException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of("error", "source_file", "message", ex.getMessage()));
  }
}
