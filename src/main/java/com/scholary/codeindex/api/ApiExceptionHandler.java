package com.scholary.codeindex.api;

import com.scholary.codeindex.service.JobSchedulingException;
import com.scholary.codeindex.service.JobValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps indexing exceptions to HTTP responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(JobValidationException.class)
  public ResponseEntity<ErrorResponse> handleValidation(JobValidationException e) {
    LOGGER.warn("Rejected indexing request: {}", e.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("invalid_request", e.getMessage()));
  }

  @ExceptionHandler(JobSchedulingException.class)
  public ResponseEntity<ErrorResponse> handleScheduling(JobSchedulingException e) {
    LOGGER.error("Job {} could not be scheduled", e.getJobId(), e);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ErrorResponse("scheduling_failed", e.getMessage()));
  }
}
