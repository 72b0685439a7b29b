package com.mk.fx.qa.bench.sut.resource;

import com.mk.fx.qa.bench.sut.cfg.ErrorResponse;
import com.mk.fx.qa.bench.sut.service.InsufficientFundsException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  static final String UNAVAILABLE = "Service unavailable. Please retry.";

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid Argument", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    var details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Invalid request body: {}", details);
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid Argument", details));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
    log.warn("Malformed request: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("Malformed Request", ex.getMessage()));
  }

  @ExceptionHandler(InsufficientFundsException.class)
  public ResponseEntity<ErrorResponse> handleInsufficientFunds(InsufficientFundsException ex) {
    log.info(ex.getMessage());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("Insufficient Funds", ex.getMessage()));
  }

  @ExceptionHandler(AsyncRequestTimeoutException.class)
  public ResponseEntity<ErrorResponse> handleTimeout(AsyncRequestTimeoutException ex) {
    log.info("Request has timed out");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ErrorResponse(UNAVAILABLE, "Request exceeded the server-side timeout"));
  }

  /** Framework errors that already carry a status, such as unknown paths. */
  @ExceptionHandler(ErrorResponseException.class)
  public ResponseEntity<ErrorResponse> handleFrameworkError(ErrorResponseException ex) {
    log.warn("Request rejected with {}: {}", ex.getStatusCode(), ex.getMessage());
    return ResponseEntity.status(ex.getStatusCode())
        .body(new ErrorResponse(ex.getBody().getTitle(), ex.getBody().getDetail()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unhandled exception", ex);
    return ResponseEntity.internalServerError()
        .body(new ErrorResponse("Server Error", ex.getMessage()));
  }
}
