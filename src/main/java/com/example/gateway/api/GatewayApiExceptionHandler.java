package com.example.gateway.api;

import com.example.gateway.auth.AuthenticationFailedException;
import com.example.gateway.circuit.CircuitOpenException;
import com.example.gateway.messaging.PublishFailureException;
import com.example.gateway.ratelimit.RateLimitExceededException;
import com.example.gateway.service.InvalidNotificationRequestException;
import com.example.gateway.service.NotificationNotFoundException;
import com.example.gateway.store.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GatewayApiExceptionHandler {

    static final String SERVICE_UNAVAILABLE = "Notification service temporarily unavailable";

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ApiResponse<Void>> handleAuthentication(AuthenticationFailedException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(ApiResponse.failure(ex.getMessage(), ex.getMessage()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleRateLimit(RateLimitExceededException ex) {
        return error(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
    }

    @ExceptionHandler({CircuitOpenException.class, PublishFailureException.class})
    public ResponseEntity<ApiResponse<Void>> handlePublishUnavailable(RuntimeException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("event=status_store_unavailable error={}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Notification status store temporarily unavailable");
    }

    @ExceptionHandler(NotificationNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(NotificationNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(InvalidNotificationRequestException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidRequest(InvalidNotificationRequestException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .sorted()
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, detail.isEmpty() ? "Validation failed" : detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return error(HttpStatus.BAD_REQUEST, "Invalid value for parameter '" + ex.getName() + "'");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // framework-level errors (unknown path, wrong method, ...) keep their own status
            HttpStatusCode status = errorResponse.getStatusCode();
            String detail = errorResponse.getBody().getDetail();
            return ResponseEntity.status(status)
                    .body(ApiResponse.failure(detail != null ? detail : "Request failed", "Request failed"));
        }
        log.error("event=unhandled_exception error={}", ex.toString(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.failure("Internal server error", "An unexpected error occurred"));
    }

    private ResponseEntity<ApiResponse<Void>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.failure(message, message));
    }
}
