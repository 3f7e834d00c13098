package com.flagship.payroll_ledger.ledger;

import com.flagship.payroll_ledger.ledger.dto.CreatePaymentRequest;
import com.flagship.payroll_ledger.ledger.dto.ForceUnmarkRequest;
import com.flagship.payroll_ledger.ledger.dto.PaymentRecordResponse;
import com.flagship.payroll_ledger.ledger.dto.WorkDaySelectionRequest;
import com.flagship.payroll_ledger.ledger.exception.LedgerValidationException;
import com.flagship.payroll_ledger.observability.CorrelationContext;
import com.flagship.payroll_ledger.payment.IdempotencyService;
import com.flagship.payroll_ledger.payment.PaymentRecord;
import com.flagship.payroll_ledger.payment.PaymentRecordStore;
import com.flagship.payroll_ledger.payment.PaymentType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP surface of the ledger engine.
 *
 * Payment creation requires an Idempotency-Key header. Repeating a request
 * with the same key returns the payment created the first time.
 * Operations that collect per-record failures answer 207 when any write failed.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final LedgerEngine ledgerEngine;
    private final PaymentRecordStore paymentRecordStore;
    private final IdempotencyService idempotencyService;

    /**
     * Records a payment and marks its days as paid.
     *
     * @return 201 with the new payment, or 200 with the payment already
     *         created under the same idempotency key
     */
    @PostMapping("/payments")
    public ResponseEntity<PaymentRecordResponse> createPayment(
            @Valid @RequestBody CreatePaymentRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Received payment request: idempotencyKey={}, employeeId={}, workDays={}",
            idempotencyKey, request.getEmployeeId(), request.getWorkDayIds().size());

        try {
            Optional<String> existingPaymentId = idempotencyService.findPaymentId(idempotencyKey);
            if (existingPaymentId.isPresent()) {
                MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, existingPaymentId.get());
                log.info("Idempotency key already used, returning existing payment");

                PaymentRecord existing = paymentRecordStore.get(existingPaymentId.get())
                    .orElseThrow(() -> new IllegalStateException(
                        "Payment found by idempotency key but no longer stored: " + existingPaymentId.get()));
                return ResponseEntity.ok(PaymentRecordResponse.from(existing));
            }

            PaymentType paymentType = PaymentType.fromLabel(request.getPaymentType())
                .orElseThrow(() -> new LedgerValidationException(
                    "Unknown payment type: " + request.getPaymentType(),
                    Map.of("paymentType", String.valueOf(request.getPaymentType()))));

            BigDecimal amount = request.getAmount() != null
                ? request.getAmount()
                : ledgerEngine.quoteAmount(request.getEmployeeId(), request.getWorkDayIds());

            PaymentRecord payment = ledgerEngine.createPaymentAndMark(CreatePaymentCommand.builder()
                .employeeId(request.getEmployeeId())
                .workDayIds(request.getWorkDayIds())
                .amount(amount)
                .paymentType(paymentType.getLabel())
                .notes(request.getNotes())
                .date(request.getDate())
                .build());

            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, payment.getId());
            try {
                idempotencyService.remember(idempotencyKey, payment.getId());
            } catch (RuntimeException e) {
                // the payment and its marks are already stored
                log.warn("Payment {} created but idempotency key {} could not be stored: {}",
                    payment.getId(), idempotencyKey, e.getMessage());
            }

            return ResponseEntity.status(HttpStatus.CREATED).body(PaymentRecordResponse.from(payment));
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    @DeleteMapping("/payments/{id}")
    public ResponseEntity<ForceUnmarkResult> deletePayment(@PathVariable("id") String id) {
        return withFailureStatus(ledgerEngine.deletePayment(id));
    }

    /**
     * Unmarks days, or reports the payments that would be affected without writing anything.
     */
    @PostMapping("/work-days/unmark")
    public ResponseEntity<UnmarkResult> unmark(@Valid @RequestBody WorkDaySelectionRequest request) {
        return ResponseEntity.ok(ledgerEngine.unmarkAsPaid(request.getWorkDayIds()));
    }

    @PostMapping("/work-days/force-unmark")
    public ResponseEntity<ForceUnmarkResult> forceUnmark(@Valid @RequestBody ForceUnmarkRequest request) {
        return withFailureStatus(
            ledgerEngine.forceUnmarkAsPaid(request.getWorkDayIds(), request.getResolutionPolicy()));
    }

    @GetMapping("/integrity")
    public ResponseEntity<IntegrityReport> validateIntegrity() {
        return ResponseEntity.ok(ledgerEngine.validateIntegrity());
    }

    @PostMapping("/integrity/repair")
    public ResponseEntity<RepairResult> repairIntegrity() {
        RepairResult result = ledgerEngine.repairIntegrity();
        return ResponseEntity.status(result.isComplete() ? HttpStatus.OK : HttpStatus.MULTI_STATUS).body(result);
    }

    private static ResponseEntity<ForceUnmarkResult> withFailureStatus(ForceUnmarkResult result) {
        return ResponseEntity.status(result.isComplete() ? HttpStatus.OK : HttpStatus.MULTI_STATUS).body(result);
    }
}
