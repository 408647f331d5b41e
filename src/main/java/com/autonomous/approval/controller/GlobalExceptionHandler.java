package com.autonomous.approval.controller;

import com.autonomous.approval.exception.AlreadyResolvedException;
import com.autonomous.approval.exception.ApprovalNotFoundException;
import com.autonomous.approval.exception.PlatformException;
import com.autonomous.approval.exception.PlatformUnavailableException;
import com.autonomous.approval.exception.SignatureVerificationException;
import com.autonomous.approval.model.ApiErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SignatureVerificationException.class)
    public ResponseEntity<ApiErrorResponse> handleSignature(SignatureVerificationException ex) {
        log.warn("[API] Rejected Slack request: {}", ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "Invalid request signature");
    }

    @ExceptionHandler(ApprovalNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(ApprovalNotFoundException ex) {
        log.warn("[API] {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(AlreadyResolvedException.class)
    public ResponseEntity<ApiErrorResponse> handleAlreadyResolved(AlreadyResolvedException ex) {
        log.warn("[API] {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(PlatformUnavailableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnavailable(PlatformUnavailableException ex) {
        log.warn("[API] Slack unavailable during {}: {}", ex.getOperation(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(PlatformException.class)
    public ResponseEntity<ApiErrorResponse> handlePlatform(PlatformException ex) {
        log.error("[API] Slack call {} failed ({})", ex.getOperation(), ex.getErrorCode(), ex);
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.builder()
            .status(status.value())
            .message(message)
            .build());
    }
}
