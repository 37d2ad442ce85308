package io.socialcomply.platform.exception;

import io.socialcomply.platform.integration.storage.StorageErrorCode;
import io.socialcomply.platform.integration.storage.StorageException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ProblemDetail> handleStorage(
      StorageException ex, HttpServletRequest request) {
    var status = statusFor(ex.getCode());
    if (status.is5xxServerError()) {
      log.error(
          "Storage failure: path={}, method={}, code={}, provider={}, key={}",
          request.getRequestURI(),
          request.getMethod(),
          ex.getCode(),
          ex.getProvider(),
          ex.getKey(),
          ex);
    } else {
      log.warn(
          "Storage request rejected: path={}, method={}, code={}, key={}",
          request.getRequestURI(),
          request.getMethod(),
          ex.getCode(),
          ex.getKey());
    }

    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(titleFor(ex.getCode()));
    problem.setDetail(ex.getMessage());
    problem.setProperty("code", ex.getCode().name());
    return ResponseEntity.status(status).body(problem);
  }

  static HttpStatus statusFor(StorageErrorCode code) {
    return switch (code) {
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
      case INVALID_KEY -> HttpStatus.BAD_REQUEST;
      case UPLOAD_FAILED, DOWNLOAD_FAILED, DELETE_FAILED -> HttpStatus.BAD_GATEWAY;
      case CONNECTION_ERROR, PROVIDER_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
      case CONFIGURATION_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }

  private static String titleFor(StorageErrorCode code) {
    return switch (code) {
      case NOT_FOUND -> "Object not found";
      case PERMISSION_DENIED -> "Access denied";
      case INVALID_KEY -> "Invalid object key";
      case UPLOAD_FAILED -> "Upload failed";
      case DOWNLOAD_FAILED -> "Download failed";
      case DELETE_FAILED -> "Delete failed";
      case CONNECTION_ERROR -> "Storage backend unreachable";
      case PROVIDER_UNAVAILABLE -> "Storage provider unavailable";
      case CONFIGURATION_ERROR -> "Storage misconfigured";
    };
  }
}
