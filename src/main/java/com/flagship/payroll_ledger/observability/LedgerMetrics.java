package com.flagship.payroll_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.payments.created: payments created, tagged by type and status
 * - ledger.operation.latency: per-operation timer
 * - ledger.rollbacks: compensating rollbacks, tagged by outcome
 * - ledger.manual_intervention: rollbacks that left residue
 * - ledger.force_unmark.failures: failed writes on the force path
 * - ledger.repair.actions: repair writes, tagged by type and result
 * - ledger.integrity.orphaned_work_days / orphaned_payments: last scan
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter manualInterventions;
    private final AtomicInteger orphanedWorkDays = new AtomicInteger();
    private final AtomicInteger orphanedPayments = new AtomicInteger();

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.manualInterventions = Counter.builder("ledger.manual_intervention")
                .description("Rollbacks that failed and left records inconsistent")
                .register(registry);

        Gauge.builder("ledger.integrity.orphaned_work_days", orphanedWorkDays, AtomicInteger::get)
                .description("Paid work days with no covering payment at the last scan")
                .register(registry);

        Gauge.builder("ledger.integrity.orphaned_payments", orphanedPayments, AtomicInteger::get)
                .description("Payments covering unpaid work days at the last scan")
                .register(registry);
    }

    public void recordPaymentCreated(String paymentType, String status) {
        registry.counter("ledger.payments.created",
                "payment_type", sanitizeTag(paymentType),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordOperationLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordRollback(String operation, String outcome) {
        registry.counter("ledger.rollbacks",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordManualIntervention() {
        manualInterventions.increment();
    }

    public void recordForceUnmarkFailures(int failures) {
        if (failures > 0) {
            registry.counter("ledger.force_unmark.failures").increment(failures);
        }
    }

    public void recordRepairAction(String type, boolean succeeded) {
        registry.counter("ledger.repair.actions",
                "type", sanitizeTag(type),
                "result", succeeded ? "success" : "failure"
        ).increment();
    }

    public void recordIntegrityScan(int orphanedWorkDayCount, int orphanedPaymentCount) {
        orphanedWorkDays.set(orphanedWorkDayCount);
        orphanedPayments.set(orphanedPaymentCount);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
