package com.scholary.medforce.api;

import com.scholary.medforce.document.DocumentNotFoundException;
import com.scholary.medforce.document.PatientAlreadyExistsException;
import com.scholary.medforce.document.PatientNotFoundException;
import com.scholary.medforce.objectstore.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Converts document store outcomes into the error bodies the admin UI expects.
 *
 * <p>Client mistakes get 400/404 with a short message. Storage failures get a 500 carrying the
 * message, with full detail logged server-side.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(DocumentNotFoundException.class)
  ResponseEntity<ApiError> handleDocumentNotFound(DocumentNotFoundException ex) {
    LOGGER.warn("File not found: {}", ex.getPath());
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiError(ex.getMessage(), ex.getPath()));
  }

  @ExceptionHandler(PatientNotFoundException.class)
  ResponseEntity<ApiError> handlePatientNotFound(PatientNotFoundException ex) {
    LOGGER.warn("Patient not found: {}", ex.getPatientId());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of(ex.getMessage()));
  }

  @ExceptionHandler(PatientAlreadyExistsException.class)
  ResponseEntity<ApiError> handlePatientExists(PatientAlreadyExistsException ex) {
    LOGGER.warn("Patient already exists: {}", ex.getPatientId());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.of(ex.getMessage()));
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MissingServletRequestParameterException.class,
    HttpMessageNotReadableException.class
  })
  ResponseEntity<ApiError> handleBadRequest(Exception ex) {
    LOGGER.warn("Rejected request: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.of(ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ResponseEntity<ApiError> handleInvalid(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request");
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.of(message));
  }

  @ExceptionHandler(ObjectStoreException.class)
  ResponseEntity<ApiError> handleStorage(ObjectStoreException ex) {
    LOGGER.error("Storage error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiError.of(ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    // Spring's own exceptions (unknown path, wrong method) already know their status
    if (ex instanceof ErrorResponse) {
      return ResponseEntity.status(((ErrorResponse) ex).getStatusCode())
          .body(ApiError.of(ex.getMessage()));
    }
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiError.of(String.valueOf(ex.getMessage())));
  }
}
