/*
 * どこで: Newsletter API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: API 仕様に沿ったエラー応答を統一するため
 */
package com.newsroom.newsletter.api;

import com.newsroom.newsletter.service.EmailDeliveryException;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(NewsletterValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(NewsletterValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ex.code(), ex.getMessage()));
  }

  @ExceptionHandler(InvalidIdempotencyKeyException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidIdempotencyKey(
      InvalidIdempotencyKeyException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.INVALID_IDEMPOTENCY_KEY, ex.getMessage()));
  }

  @ExceptionHandler(IdempotencyInProgressException.class)
  public ResponseEntity<ApiErrorResponse> handleIdempotencyInProgress(
      IdempotencyInProgressException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.IDEMPOTENCY_REQUEST_IN_PROGRESS, ex.getMessage()));
  }

  @ExceptionHandler(IssueNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleIssueNotFound(IssueNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.ISSUE_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(InvalidSubscriptionTokenException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidSubscriptionToken(
      InvalidSubscriptionTokenException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.INVALID_SUBSCRIPTION_TOKEN, ex.getMessage()));
  }

  @ExceptionHandler(SubscriptionTokenNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownSubscriptionToken(
      SubscriptionTokenNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse(ApiErrorCode.UNKNOWN_SUBSCRIPTION_TOKEN, ex.getMessage()));
  }

  @ExceptionHandler(EmailDeliveryException.class)
  public ResponseEntity<ApiErrorResponse> handleEmailDelivery(EmailDeliveryException ex) {
    // 購読行は確認待ちのまま残るので、同じ email で再登録すれば同じトークンで再送される
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.CONFIRMATION_EMAIL_FAILED, "confirmation email could not be sent"));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    // UUID でないヘッダ/パスは変換前の値を返さず、項目名だけ伝える
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    return badRequest(resolveUnreadableBodyMessage(ex));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private String resolveUnreadableBodyMessage(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return "request body is required";
    }
    return "request body is invalid";
  }
}
