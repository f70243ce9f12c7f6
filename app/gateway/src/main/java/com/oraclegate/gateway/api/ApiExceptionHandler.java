/*
 * どこで: Gateway API
 * 何を: 例外を {ok:false, error, message} 形式の HTTP レスポンスへ変換する
 * なぜ: 受付拒否と同じ形でエラーを返し、内部の詳細はログにだけ残すため
 */
package com.oraclegate.gateway.api;

import com.oraclegate.gateway.security.ApiKeyNotFoundException;
import com.oraclegate.gateway.security.ApiKeyValidationException;
import com.oraclegate.gateway.tool.ToolCommandException;
import com.oraclegate.gateway.tool.ToolDisabledException;
import com.oraclegate.gateway.tool.UnknownToolException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ApiKeyValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(ApiKeyValidationException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler({ApiKeyNotFoundException.class, UnknownToolException.class})
  public ResponseEntity<ApiErrorResponse> handleNotFound(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(ApiErrorResponse.of(ApiErrorCode.NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(ApiKeyAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(ApiKeyAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(ApiErrorResponse.of(ApiErrorCode.PERMISSION_DENIED, ex.getMessage()));
  }

  @ExceptionHandler(ToolCommandException.class)
  public ResponseEntity<ApiErrorResponse> handleToolFailure(ToolCommandException ex) {
    logger.warn("tool command failed", ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(ApiErrorResponse.of(ApiErrorCode.TOOL_FAILED, "tool command failed"));
  }

  @ExceptionHandler(ToolDisabledException.class)
  public ResponseEntity<ApiErrorResponse> handleToolDisabled(ToolDisabledException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ApiErrorResponse.of(ApiErrorCode.TOOL_DISABLED, ex.getMessage()));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
    // 接続プール枯渇/タイムアウトを含む。詳細はログにだけ出す
    logger.error("store access failed", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ApiErrorResponse.of(ApiErrorCode.UPSTREAM_UNAVAILABLE));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return badRequest(ex.getParameterName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSON パーサの内部文言は露出しない
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiErrorResponse.of(ApiErrorCode.VALIDATION_ERROR, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
