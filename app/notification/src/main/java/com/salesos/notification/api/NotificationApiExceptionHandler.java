/*
 * Where: Notification API
 * What: Maps service exceptions to {code, message} error bodies
 */
package com.salesos.notification.api;

import com.salesos.notification.apns.ApnsConfigurationException;
import com.salesos.notification.service.NotificationJobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class NotificationApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(NotificationApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("NOTIFICATION_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("NOTIFICATION_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(NotificationJobNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(NotificationJobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("NOTIFICATION_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(ApnsConfigurationException.class)
  public ResponseEntity<ApiErrorResponse> handleNativePushUnavailable(ApnsConfigurationException ex) {
    logger.error("native push is not configured", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("NOTIFICATION_NATIVE_PUSH_UNAVAILABLE", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("notification api failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("NOTIFICATION_INTERNAL_ERROR", ex.getMessage()));
  }
}
