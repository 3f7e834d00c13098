package com.flagship.payroll_ledger.ledger.exception;

import com.flagship.payroll_ledger.ledger.SagaReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger failures to consistent error bodies.
 *
 * Rolled-back writes answer 500 with the saga report so the caller can see
 * what was undone. Manual intervention also answers 500 and lists the records
 * left inconsistent.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, Object> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing,
                LinkedHashMap::new
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body could not be read", null);
    }

    @ExceptionHandler(LedgerValidationException.class)
    public ResponseEntity<ErrorResponse> handleLedgerValidation(LedgerValidationException e) {
        log.warn("Ledger validation failed: {} {}", e.getMessage(), e.getOffendingIds());
        Map<String, Object> details = e.getOffendingIds().isEmpty() ? null : new LinkedHashMap<>(e.getOffendingIds());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", e.getMessage(), details);
    }

    @ExceptionHandler(LedgerReadException.class)
    public ResponseEntity<ErrorResponse> handleLedgerRead(LedgerReadException e) {
        log.error("Ledger read failed: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Store Unavailable", e.getMessage(), null);
    }

    @ExceptionHandler(PartialWriteException.class)
    public ResponseEntity<ErrorResponse> handlePartialWrite(PartialWriteException e) {
        log.error("Write rolled back: {}", e.getReport().summary());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Write Rolled Back", e.getMessage(),
            reportDetails(e.getReport()));
    }

    @ExceptionHandler(PaymentCreateException.class)
    public ResponseEntity<ErrorResponse> handlePaymentCreate(PaymentCreateException e) {
        log.error("Payment write rolled back: {}", e.getReport().summary());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Write Rolled Back", e.getMessage(),
            reportDetails(e.getReport()));
    }

    @ExceptionHandler(ManualInterventionRequiredException.class)
    public ResponseEntity<ErrorResponse> handleManualIntervention(ManualInterventionRequiredException e) {
        log.error("Manual intervention required at {}: {}", e.getFailedStage(), e.getResidualIds());
        Map<String, Object> details = reportDetails(e.getReport());
        details.put("failedStage", e.getFailedStage().name());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Manual Intervention Required", e.getMessage(), details);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", null);
    }

    private static Map<String, Object> reportDetails(SagaReport report) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", report.getOperation());
        details.put("outcome", report.getOutcome().name());
        details.put("completedRecordIds", report.completedRecordIds());
        details.put("residualRecordIds", report.residualRecordIds());
        return details;
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, Object> details;
        Instant timestamp;
    }
}
