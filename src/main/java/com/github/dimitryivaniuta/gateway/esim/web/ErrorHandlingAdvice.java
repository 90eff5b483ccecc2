package com.github.dimitryivaniuta.gateway.esim.web;

import com.github.dimitryivaniuta.gateway.esim.vendor.InvalidOrderRequestException;
import com.github.dimitryivaniuta.gateway.esim.vendor.VendorUnavailableException;
import com.github.dimitryivaniuta.gateway.esim.web.dto.ErrorResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception mapping for the operations API.
 */
@Slf4j
@RestControllerAdvice
public class ErrorHandlingAdvice {

    @ExceptionHandler({ConstraintViolationException.class, InvalidOrderRequestException.class})
    public ResponseEntity<ErrorResponse> handleValidation(RuntimeException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("VALIDATION_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("VALIDATION_ERROR", ex.getMessage()));
    }

    /**
     * Known API exceptions.
     *
     * @param ex exception
     * @return response
     */
    @ExceptionHandler(ErrorResponseException.class)
    public ResponseEntity<ProblemDetail> handleErrorResponseException(ErrorResponseException ex) {
        return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
    }

    /**
     * Vendor timeouts and transport errors.
     *
     * @param ex exception
     * @return 503
     */
    @ExceptionHandler(VendorUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleVendorUnavailable(VendorUnavailableException ex) {
        log.warn("Vendor unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of("VENDOR_UNAVAILABLE", ex.getMessage()));
    }

    /**
     * Fallback. The message is not echoed because it may carry vendor or database details.
     *
     * @param ex exception
     * @return error response
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleFallback(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("INTERNAL_ERROR", "Internal error"));
    }
}
