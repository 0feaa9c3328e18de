/*
 * どこで: Arena API
 * 何を: ドメイン例外/入力検証エラーを ApiErrorResponse へ変換する
 * なぜ: 未検出/認可/状態/下流エラーをそれぞれ別のステータスとコードで返すため
 */
package com.chessmatch.arena.api;

import com.chessmatch.arena.service.ChessWorkersIntegrationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final String VALIDATION_FAILED = "request validation failed";

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ARENA_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(DuplicateIdentityException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicate(DuplicateIdentityException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ARENA_DUPLICATE_IDENTITY", ex.getMessage()));
  }

  @ExceptionHandler(InvalidCredentialsException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidCredentials(
      InvalidCredentialsException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse("ARENA_INVALID_CREDENTIALS", ex.getMessage()));
  }

  @ExceptionHandler(ActionForbiddenException.class)
  public ResponseEntity<ApiErrorResponse> handleForbidden(ActionForbiddenException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("ARENA_FORBIDDEN", ex.getMessage()));
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(ResourceNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("ARENA_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(NotYourTurnException.class)
  public ResponseEntity<ApiErrorResponse> handleNotYourTurn(NotYourTurnException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("ARENA_NOT_YOUR_TURN", ex.getMessage()));
  }

  @ExceptionHandler(StateConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleStateConflict(StateConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("ARENA_STATE_CONFLICT", ex.getMessage()));
  }

  @ExceptionHandler(ChessWorkersIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleWorkers(ChessWorkersIntegrationException ex) {
    if (ex.isClientError()) {
      return ResponseEntity.status(HttpStatus.BAD_REQUEST)
          .body(new ApiErrorResponse("ARENA_MOVE_REJECTED", ex.getMessage()));
    }
    // 下流の詳細は利用者へ返さない
    logger.error("chess-workers failure reason={}", ex.reason(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("ARENA_WORKERS_FAILURE", "move validation is unavailable"));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    final FieldError fieldError = ex.getBindingResult().getFieldError();
    final String message =
        fieldError == null || fieldError.getDefaultMessage() == null
            ? VALIDATION_FAILED
            : fieldError.getDefaultMessage();
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("ARENA_VALIDATION_ERROR", message));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .findFirst()
            .orElse(VALIDATION_FAILED);
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("ARENA_VALIDATION_ERROR", message));
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodValidation(
      HandlerMethodValidationException ex) {
    final String message =
        ex.getAllErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(value -> value != null && !value.isBlank())
            .findFirst()
            .orElse(VALIDATION_FAILED);
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ApiErrorResponse("ARENA_VALIDATION_ERROR", message));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiErrorResponse> handleMalformed(Exception ex) {
    logger.debug("malformed request", ex);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ARENA_BAD_REQUEST", "malformed request"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("ARENA_INTERNAL_ERROR", "internal server error"));
  }
}
