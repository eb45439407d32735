package com.mk.fx.qa.stress.resource;

import com.mk.fx.qa.stress.cfg.ErrorResponse;
import com.mk.fx.qa.stress.executors.StressStartupException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

  private final ApiResponseFactory responseFactory;

  @ExceptionHandler(StressStartupException.class)
  public ResponseEntity<ErrorResponse> handleStartup(StressStartupException ex) {
    log.warn("Stress client could not start: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.SERVICE_UNAVAILABLE, "Target Unreachable", ex.getMessage());
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException ex) {
    log.warn("Rejected lifecycle request: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.CONFLICT, "Invalid State", ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unhandled exception", ex);
    return responseFactory.error(HttpStatus.INTERNAL_SERVER_ERROR, "Server Error", ex.getMessage());
  }
}
