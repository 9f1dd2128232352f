package com.nevis.dossier.controller;

import com.nevis.dossier.exception.BlobStoreUnavailableException;
import com.nevis.dossier.exception.DocumentBusyException;
import com.nevis.dossier.exception.EntityNotFoundException;
import com.nevis.dossier.exception.InvalidBatchException;
import com.nevis.dossier.exception.InvalidOverridesException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return error(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler({InvalidBatchException.class, InvalidOverridesException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex) {
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(fieldError -> String.format("Field '%s' %s", fieldError.getField(), fieldError.getDefaultMessage()))
            .orElse("Request validation failed");
        return error(message, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex) {
        return error("Request validation failed", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return error(String.format("Parameter '%s' has an invalid value", ex.getName()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return error("Malformed request body", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(DocumentBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(DocumentBusyException ex) {
        return error(ex.getMessage(), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(BlobStoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleBlobStoreUnavailable(BlobStoreUnavailableException ex) {
        log.error("Blob store unavailable: {}", ex.getMessage());
        return error("Document storage is temporarily unavailable", HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled request failure", ex);
        return error("An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(String message, HttpStatus status) {
        ErrorResponse error = new ErrorResponse(
            message,
            status.value(),
            Instant.now().toEpochMilli()
        );
        return new ResponseEntity<>(error, status);
    }
}
