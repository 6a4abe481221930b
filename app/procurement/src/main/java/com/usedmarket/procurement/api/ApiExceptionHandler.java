package com.usedmarket.procurement.api;

import com.usedmarket.procurement.client.HostIntegrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidProcurementRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(
      InvalidProcurementRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("PROCUREMENT_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ApiErrorResponse> handleConfiguration(ConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("PROCUREMENT_UNKNOWN_TIER", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("PROCUREMENT_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse(
                "PROCUREMENT_BAD_REQUEST", "missing header: " + ex.getHeaderName()));
  }

  @ExceptionHandler(InsufficientFundsException.class)
  public ResponseEntity<ApiErrorResponse> handleInsufficientFunds(InsufficientFundsException ex) {
    return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
        .body(new ApiErrorResponse("PROCUREMENT_INSUFFICIENT_FUNDS", ex.getMessage()));
  }

  @ExceptionHandler(ResourceAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(ResourceAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("PROCUREMENT_FORBIDDEN", ex.getMessage()));
  }

  @ExceptionHandler(SearchNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleSearchNotFound(SearchNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("PROCUREMENT_SEARCH_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(ListingNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleListingNotFound(ListingNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("PROCUREMENT_LISTING_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(InvalidSearchStateException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidState(InvalidSearchStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("PROCUREMENT_INVALID_STATE", ex.getMessage()));
  }

  @ExceptionHandler(AcquisitionFailedException.class)
  public ResponseEntity<ApiErrorResponse> handleAcquisitionFailed(AcquisitionFailedException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ApiErrorResponse("PROCUREMENT_ACQUISITION_FAILED", ex.getMessage()));
  }

  @ExceptionHandler(HostIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleHostIntegration(HostIntegrationException ex) {
    logger.warn("host integration failed reason={}", ex.reason(), ex);
    if (ex.reason() == HostIntegrationException.Reason.TIMEOUT) {
      return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
          .body(new ApiErrorResponse("PROCUREMENT_HOST_TIMEOUT", ex.getMessage()));
    }
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ApiErrorResponse("PROCUREMENT_HOST_UNAVAILABLE", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected procurement error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("PROCUREMENT_INTERNAL_ERROR", ex.getMessage()));
  }
}
