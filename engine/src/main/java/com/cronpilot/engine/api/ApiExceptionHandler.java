package com.cronpilot.engine.api;

import com.cronpilot.engine.api.dto.ErrorResponse;
import com.cronpilot.engine.definition.JobValidationException;
import com.cronpilot.engine.store.JobNotFoundException;
import com.cronpilot.engine.store.RunNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps engine exceptions to HTTP statuses:
 * validation failures to 400 with per-field errors, unknown jobs and runs to 404.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(JobValidationException.class)
    public ResponseEntity<ErrorResponse> invalidJob(JobValidationException e) {
        log.info("Rejected job definition: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("Invalid job definition", e.getViolations(), Instant.now()));
    }

    @ExceptionHandler({JobNotFoundException.class, RunNotFoundException.class})
    public ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
    }
}
