package com.uptime.keeper.monitor.api;

import com.uptime.keeper.monitor.persistence.ConfigStoreException;
import com.uptime.keeper.monitor.registry.DuplicateTargetException;
import com.uptime.keeper.monitor.registry.InvalidTargetConfigException;
import com.uptime.keeper.monitor.registry.TargetNotFoundException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class MonitorExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(MonitorExceptionHandler.class);

  @ExceptionHandler(DuplicateTargetException.class)
  public ResponseEntity<Map<String, String>> handleDuplicate(DuplicateTargetException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "duplicate_target", "message", ex.getMessage()));
  }

  @ExceptionHandler(TargetNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(TargetNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "target_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidTargetConfigException.class)
  public ResponseEntity<Map<String, String>> handleInvalid(InvalidTargetConfigException ex) {
    return ResponseEntity.badRequest()
        .body(Map.of("error", "invalid_config", "message", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest()
        .body(Map.of("error", "invalid_config", "message", "request body is not valid JSON for this operation"));
  }

  @ExceptionHandler(ConfigStoreException.class)
  public ResponseEntity<Map<String, String>> handleStore(ConfigStoreException ex) {
    log.warn("Config store unavailable", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "config_store_unavailable", "message", ex.getMessage()));
  }
}
