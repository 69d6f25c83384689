package com.phonebook.directory.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class DirectoryApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(DirectoryApiExceptionHandler.class);

  @ExceptionHandler(InvalidPersonInputException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidInput(InvalidPersonInputException ex) {
    return invalidInput();
  }

  @ExceptionHandler(PersonConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleConflict(PersonConflictException ex) {
    final ApiErrorCode code =
        ex.kind() == PersonConflictException.ConflictKind.PHONE_NUMBER
            ? ApiErrorCode.PHONE_NUMBER_CONFLICT
            : ApiErrorCode.PERSON_CONFLICT;
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(PersonNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(PersonNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.PERSON_NOT_FOUND, ex.getMessage()));
  }

  // A missing query parameter or JSON body is malformed input like any other.
  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return invalidInput();
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    return invalidInput();
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("directory request failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, "internal error"));
  }

  private ResponseEntity<ApiErrorResponse> invalidInput() {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.INVALID_INPUT, InvalidPersonInputException.MESSAGE));
  }
}
