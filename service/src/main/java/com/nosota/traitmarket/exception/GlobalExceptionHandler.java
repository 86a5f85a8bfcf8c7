package com.nosota.traitmarket.exception;

import com.nosota.traitmarket.dto.ErrorResponse;
import com.nosota.traitmarket.error.BroadcastException;
import com.nosota.traitmarket.error.ConfirmationTimeoutException;
import com.nosota.traitmarket.error.NotFoundException;
import com.nosota.traitmarket.error.OutOfStockException;
import com.nosota.traitmarket.error.OwnershipException;
import com.nosota.traitmarket.error.ReservationExpiredException;
import com.nosota.traitmarket.error.SimulationException;
import com.nosota.traitmarket.error.TransactionBuildException;
import com.nosota.traitmarket.error.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(OutOfStockException.class)
    public ResponseEntity<ErrorResponse> handleOutOfStock(
            OutOfStockException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.info("Out of stock [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.CONFLICT, "Out Of Stock",
                "This trait is no longer available", request);
    }

    @ExceptionHandler(ReservationExpiredException.class)
    public ResponseEntity<ErrorResponse> handleReservationExpired(
            ReservationExpiredException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.info("Reservation expired [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.GONE, "Reservation Expired",
                "Your reservation has expired, please reserve the trait again", request);
    }

    @ExceptionHandler(OwnershipException.class)
    public ResponseEntity<ErrorResponse> handleOwnership(
            OwnershipException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Ownership check failed [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.FORBIDDEN, "Ownership Error",
                "Your wallet no longer holds this asset", request);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Validation error [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), request);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            NotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Not found [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(TransactionBuildException.class)
    public ResponseEntity<ErrorResponse> handleTransactionBuild(
            TransactionBuildException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Transaction build error [correlationId={}]: {}", correlationId, ex.getMessage(), ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Transaction Build Error",
                "The purchase transaction could not be prepared: " + ex.getMessage(), request);
    }

    @ExceptionHandler(SimulationException.class)
    public ResponseEntity<ErrorResponse> handleSimulation(
            SimulationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Simulation rejected [correlationId={}, paymentExecuted={}, updateExecuted={}]: {}",
                correlationId, ex.isPaymentExecuted(), ex.isUpdateExecuted(), ex.getMessage());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Simulation Error",
                "The ledger would reject this transaction (check your balance): " + ex.getMessage(), request);
    }

    @ExceptionHandler(BroadcastException.class)
    public ResponseEntity<ErrorResponse> handleBroadcast(
            BroadcastException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Ledger communication error [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Network Error",
                "Network error while talking to the ledger, please retry", request);
    }

    @ExceptionHandler(ConfirmationTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleConfirmationTimeout(
            ConfirmationTimeoutException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Confirmation pending [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.ACCEPTED, "Confirmation Pending",
                "Transaction " + ex.getSignature() + " was sent; its confirmation is still pending", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Request validation failed [correlationId={}]: {}", correlationId, message);

        return respond(HttpStatus.BAD_REQUEST, "Validation Error", message, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Constraint violation [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Malformed request [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal state [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.CONFLICT, "Invalid State", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
