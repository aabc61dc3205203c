package com.polyhunter.bounty.controller;

import com.polyhunter.bounty.dto.ErrorResponse;
import com.polyhunter.bounty.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;

/**
 * Maps service failures to HTTP responses
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Invalid Transition", ex.getMessage());
    }

    @ExceptionHandler(ConcurrentReviewException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentReview(ConcurrentReviewException ex) {
        log.warn("Concurrent modification: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Concurrent Modification", ex.getMessage());
    }

    @ExceptionHandler(NotReviewableException.class)
    public ResponseEntity<ErrorResponse> handleNotReviewable(NotReviewableException ex) {
        log.warn("Not reviewable: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Not Reviewable", ex.getMessage());
    }

    @ExceptionHandler(BudgetExceededException.class)
    public ResponseEntity<ErrorResponse> handleBudgetExceeded(BudgetExceededException ex) {
        log.warn("Budget exceeded: would spend {} of {} cents", ex.getWouldSpendCents(), ex.getBudgetTotalCents());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Budget Exceeded", ex.getMessage());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex) {
        return build(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        FieldError first = ex.getBindingResult().getFieldError();
        String message = first != null ? first.getDefaultMessage() : "Invalid request";
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", message);
    }

    @ExceptionHandler(UnknownValueException.class)
    public ResponseEntity<ErrorResponse> handleUnknownValue(UnknownValueException ex) {
        log.debug("Unknown value: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage());
    }

    @ExceptionHandler(ArithmeticException.class)
    public ResponseEntity<ErrorResponse> handleAmountOverflow(ArithmeticException ex) {
        log.warn("Amount overflow: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Amount Out Of Range",
                "Amounts exceed the supported range");
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingRequestHeaderException.class })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.debug("Bad request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(DataAccessException ex) {
        log.error("Store unavailable", ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Store Unavailable", "Operation failed, please retry later");
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
