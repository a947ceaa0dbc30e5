package com.mk.fx.qa.vecro.resource;

import com.mk.fx.qa.vecro.cfg.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/** Failures raised by Spring MVC before the workload transport is reached. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex) {
    log.debug("Rejected method {}", ex.getMethod());
    return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
        .body(new ErrorResponse("Method Not Allowed", ex.getMessage()));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
    log.debug("No resource for {} {}", ex.getHttpMethod(), ex.getResourcePath());
    return withStatus(ex.getStatusCode(), ex);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    if (ex instanceof org.springframework.web.ErrorResponse framework
        && !framework.getStatusCode().is5xxServerError()) {
      log.debug("Rejected request: {}", ex.getMessage());
      return withStatus(framework.getStatusCode(), ex);
    }
    log.error("Unhandled exception", ex);
    return ResponseEntity.internalServerError()
        .body(new ErrorResponse("Server Error", ex.getMessage()));
  }

  private static ResponseEntity<ErrorResponse> withStatus(HttpStatusCode status, Exception ex) {
    HttpStatus known = HttpStatus.resolve(status.value());
    String title = known != null ? known.getReasonPhrase() : "Error";
    return ResponseEntity.status(status).body(new ErrorResponse(title, ex.getMessage()));
  }
}
