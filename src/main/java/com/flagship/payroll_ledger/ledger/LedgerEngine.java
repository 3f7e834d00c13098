package com.flagship.payroll_ledger.ledger;

import com.flagship.payroll_ledger.employee.Employee;
import com.flagship.payroll_ledger.employee.EmployeeStore;
import com.flagship.payroll_ledger.employee.WageResolver;
import com.flagship.payroll_ledger.ledger.exception.LedgerException;
import com.flagship.payroll_ledger.ledger.exception.LedgerReadException;
import com.flagship.payroll_ledger.ledger.exception.LedgerValidationException;
import com.flagship.payroll_ledger.ledger.exception.ManualInterventionRequiredException;
import com.flagship.payroll_ledger.ledger.exception.ManualInterventionRequiredException.FailedStage;
import com.flagship.payroll_ledger.ledger.exception.PartialWriteException;
import com.flagship.payroll_ledger.ledger.exception.PaymentCreateException;
import com.flagship.payroll_ledger.observability.CorrelationContext;
import com.flagship.payroll_ledger.observability.LedgerMetrics;
import com.flagship.payroll_ledger.payment.PaymentRecord;
import com.flagship.payroll_ledger.payment.PaymentRecordStore;
import com.flagship.payroll_ledger.workday.WorkRecord;
import com.flagship.payroll_ledger.workday.WorkRecordStore;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Keeps work day paid flags and payment records in agreement on top of
 * stores that only offer single-document writes.
 *
 * Operations:
 * - createPaymentAndMark: mark days paid, then write the payment; compensates on failure
 * - unmarkAsPaid: unmark days, but only if no payment covers them
 * - forceUnmarkAsPaid: delete or shrink covering payments, then unmark; best-effort
 * - validateIntegrity: read-only scan for paid flags and payments that disagree
 * - repairIntegrity: explicit fix-up of what the scan finds
 *
 * Known limitation: there is no locking. Two callers touching overlapping
 * work days concurrently can race and leave the ledger inconsistent; the
 * integrity scan finds the result and repair fixes it. Nothing here retries
 * or repairs implicitly.
 */
@Slf4j
public class LedgerEngine {

    static final String CREATE_PAYMENT = "create_payment_and_mark";
    static final String UNMARK = "unmark_as_paid";
    static final String FORCE_UNMARK = "force_unmark_as_paid";
    static final String VALIDATE = "validate_integrity";
    static final String REPAIR = "repair_integrity";

    private final WorkRecordStore workRecordStore;
    private final PaymentRecordStore paymentRecordStore;
    private final EmployeeStore employeeStore;
    private final WageResolver wageResolver;
    private final ShrinkAmountPolicy shrinkAmountPolicy;
    private final Executor scanExecutor;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public LedgerEngine(WorkRecordStore workRecordStore,
                        PaymentRecordStore paymentRecordStore,
                        EmployeeStore employeeStore,
                        WageResolver wageResolver,
                        ShrinkAmountPolicy shrinkAmountPolicy,
                        Executor scanExecutor,
                        Clock clock,
                        LedgerMetrics metrics) {
        this.workRecordStore = Objects.requireNonNull(workRecordStore);
        this.paymentRecordStore = Objects.requireNonNull(paymentRecordStore);
        this.employeeStore = Objects.requireNonNull(employeeStore);
        this.wageResolver = Objects.requireNonNull(wageResolver);
        this.shrinkAmountPolicy = Objects.requireNonNull(shrinkAmountPolicy);
        this.scanExecutor = Objects.requireNonNull(scanExecutor);
        this.clock = Objects.requireNonNull(clock);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Records a payment for worked days.
     *
     * Days are marked paid first and the payment is written last: a day left
     * paid with no payment is something the integrity scan can find and
     * repair, whereas a payment whose days are unmarked looks legitimate.
     *
     * @return the stored payment
     * @throws LedgerValidationException if a day is missing, not worked, belongs to
     *         another employee or is already covered by a payment
     * @throws PartialWriteException if marking failed and was rolled back
     * @throws PaymentCreateException if the payment write failed and the marks were rolled back
     * @throws ManualInterventionRequiredException if a rollback write failed
     */
    public PaymentRecord createPaymentAndMark(CreatePaymentCommand command) {
        long startTime = System.currentTimeMillis();
        String paymentType = command.getPaymentType();
        MDC.put(CorrelationContext.EMPLOYEE_ID_MDC_KEY, command.getEmployeeId());

        try {
            validateCreateArguments(command);
            List<String> workDayIds = requireWorkDayIds(command.getWorkDayIds());

            Map<String, WorkRecord> snapshot = readWorkRecords(workDayIds, CREATE_PAYMENT);
            List<PaymentRecord> existingPayments = readPayments(CREATE_PAYMENT);
            rejectUnpayableDays(command.getEmployeeId(), workDayIds, snapshot, existingPayments);

            CompensatingTransaction saga = new CompensatingTransaction(CREATE_PAYMENT);
            try {
                for (String workDayId : workDayIds) {
                    WorkRecord original = snapshot.get(workDayId);
                    saga.execute("mark work day paid", workDayId,
                        () -> workRecordStore.put(original.withPaid(true)),
                        () -> workRecordStore.put(original));
                }
            } catch (RuntimeException e) {
                throw rollBack(saga, e, FailedStage.MARK_WORK_DAYS,
                    report -> new PartialWriteException("Failed to mark work days as paid", report, e));
            }

            PaymentRecord payment = PaymentRecord.create(
                command.getEmployeeId(),
                workDayIds,
                command.getAmount(),
                paymentType.trim(),
                command.getDate() != null ? command.getDate() : LocalDate.now(clock),
                command.getNotes(),
                Instant.now(clock)
            );
            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, payment.getId());

            try {
                saga.execute("create payment record", payment.getId(),
                    () -> paymentRecordStore.put(payment),
                    () -> paymentRecordStore.delete(payment.getId()));
            } catch (RuntimeException e) {
                throw rollBack(saga, e, FailedStage.CREATE_PAYMENT,
                    report -> new PaymentCreateException("Failed to write payment record", report, e));
            }
            saga.commit();

            metrics.recordPaymentCreated(payment.getPaymentType(), "success");
            log.info("Payment created: amount={}, type={}, workDays={}",
                payment.getAmount(), payment.getPaymentType(), payment.getWorkDayIds());
            return payment;

        } catch (LedgerException e) {
            metrics.recordPaymentCreated(paymentType, e.getClass().getSimpleName());
            log.warn("Payment creation failed: {}", e.getMessage());
            throw e;
        } finally {
            metrics.recordOperationLatency(CREATE_PAYMENT, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.EMPLOYEE_ID_MDC_KEY);
        }
    }

    /**
     * Unmarks days as paid unless a payment covers any of them.
     *
     * When payments are affected nothing is written; the result carries the
     * payments and a summary so the caller can ask for confirmation and then
     * call {@link #forceUnmarkAsPaid}.
     */
    public UnmarkResult unmarkAsPaid(List<String> workDayIds) {
        long startTime = System.currentTimeMillis();
        try {
            List<String> ids = requireWorkDayIds(workDayIds);

            List<PaymentRecord> affected = readPayments(UNMARK).stream()
                .filter(payment -> payment.coversAny(ids))
                .toList();
            if (!affected.isEmpty()) {
                log.info("Unmark of {} needs confirmation: {} payment(s) cover these days", ids, affected.size());
                return UnmarkResult.confirmationRequired(affected);
            }

            Map<String, WorkRecord> snapshot = readWorkRecords(ids, UNMARK);
            Map<String, String> missing = new LinkedHashMap<>();
            ids.stream()
                .filter(id -> !snapshot.containsKey(id))
                .forEach(id -> missing.put(id, "work day not found"));
            if (!missing.isEmpty()) {
                throw new LedgerValidationException("Cannot unmark unknown work days", missing);
            }

            CompensatingTransaction saga = new CompensatingTransaction(UNMARK);
            try {
                for (String id : ids) {
                    WorkRecord original = snapshot.get(id);
                    saga.execute("unmark work day paid", id,
                        () -> workRecordStore.put(original.withPaid(false)),
                        () -> workRecordStore.put(original));
                }
            } catch (RuntimeException e) {
                throw rollBack(saga, e, FailedStage.UNMARK_WORK_DAYS,
                    report -> new PartialWriteException("Failed to unmark work days", report, e));
            }
            saga.commit();

            log.info("Unmarked {} work day(s) as paid", ids.size());
            return UnmarkResult.applied(ids);
        } finally {
            metrics.recordOperationLatency(UNMARK, System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Unmarks days after the caller confirmed, resolving every covering payment.
     *
     * A payment left with no days is deleted. Otherwise {@link ResolutionPolicy#DELETE}
     * deletes it and {@link ResolutionPolicy#SHRINK} rewrites it without the
     * target days and with a recomputed amount.
     *
     * Best-effort, not atomic: there is no rollback. A failed write is listed
     * in the result and the remaining writes still run, so the caller can
     * retry or run the integrity scan.
     */
    public ForceUnmarkResult forceUnmarkAsPaid(List<String> workDayIds, ResolutionPolicy resolutionPolicy) {
        long startTime = System.currentTimeMillis();
        try {
            if (resolutionPolicy == null) {
                throw new LedgerValidationException("A resolution policy is required");
            }
            List<String> ids = requireWorkDayIds(workDayIds);
            List<PaymentRecord> affected = readPayments(FORCE_UNMARK).stream()
                .filter(payment -> payment.coversAny(ids))
                .toList();

            List<String> deletedPaymentIds = new ArrayList<>();
            List<PaymentRecord> updatedPayments = new ArrayList<>();
            List<String> unmarkedWorkDayIds = new ArrayList<>();
            List<ForceUnmarkResult.Failure> failures = new ArrayList<>();

            for (PaymentRecord payment : affected) {
                List<String> remaining = payment.remainingAfterRemoving(ids);
                if (remaining.isEmpty() || resolutionPolicy == ResolutionPolicy.DELETE) {
                    try {
                        paymentRecordStore.delete(payment.getId());
                        deletedPaymentIds.add(payment.getId());
                        log.info("Deleted payment {} ({} day(s), amount {})",
                            payment.getId(), payment.getWorkDayIds().size(), payment.getAmount());
                    } catch (RuntimeException e) {
                        failures.add(failure(payment.getId(), "delete payment", e));
                    }
                } else {
                    try {
                        PaymentRecord shrunk = payment.withCoverage(remaining, shrunkAmount(payment, remaining));
                        paymentRecordStore.put(shrunk);
                        updatedPayments.add(shrunk);
                        log.info("Shrunk payment {} from {} to {} day(s), amount {} -> {}",
                            payment.getId(), payment.getWorkDayIds().size(), remaining.size(),
                            payment.getAmount(), shrunk.getAmount());
                    } catch (RuntimeException e) {
                        failures.add(failure(payment.getId(), "shrink payment", e));
                    }
                }
            }

            for (String id : ids) {
                try {
                    Optional<WorkRecord> record = workRecordStore.get(id);
                    if (record.isEmpty()) {
                        failures.add(new ForceUnmarkResult.Failure(id, "unmark work day", "work day not found"));
                        continue;
                    }
                    workRecordStore.put(record.get().withPaid(false));
                    unmarkedWorkDayIds.add(id);
                } catch (RuntimeException e) {
                    failures.add(failure(id, "unmark work day", e));
                }
            }

            ForceUnmarkResult result = new ForceUnmarkResult(resolutionPolicy, List.copyOf(deletedPaymentIds),
                List.copyOf(updatedPayments), List.copyOf(unmarkedWorkDayIds), List.copyOf(failures));
            metrics.recordForceUnmarkFailures(failures.size());
            if (!result.isComplete()) {
                log.warn("Forced unmark finished with {} failure(s); ledger may be inconsistent until "
                    + "the writes are retried or integrity is repaired: {}", failures.size(), failures);
            }
            return result;
        } finally {
            metrics.recordOperationLatency(FORCE_UNMARK, System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Deletes a payment and unmarks every day it covered.
     */
    public ForceUnmarkResult deletePayment(String paymentId) {
        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId);
        try {
            PaymentRecord payment;
            try {
                payment = paymentRecordStore.get(paymentId).orElse(null);
            } catch (RuntimeException e) {
                throw new LedgerReadException("Failed to read payment " + paymentId, e);
            }
            if (payment == null) {
                throw new LedgerValidationException("Payment not found", Map.of(paymentId, "payment not found"));
            }
            return forceUnmarkAsPaid(payment.getWorkDayIds(), ResolutionPolicy.DELETE);
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    /**
     * @return the resolved pay owed for the given days
     */
    public BigDecimal quoteAmount(String employeeId, List<String> workDayIds) {
        List<String> ids = requireWorkDayIds(workDayIds);
        Employee employee = readEmployee(employeeId)
            .orElseThrow(() -> new LedgerValidationException("Employee not found",
                Map.of(String.valueOf(employeeId), "employee not found")));

        Map<String, WorkRecord> records = readWorkRecords(ids, "quote_amount");
        Map<String, String> offending = new LinkedHashMap<>();
        for (String id : ids) {
            WorkRecord record = records.get(id);
            if (record == null) {
                offending.put(id, "work day not found");
            } else if (!employeeId.equals(record.getEmployeeId())) {
                offending.put(id, "belongs to employee " + record.getEmployeeId());
            }
        }
        if (!offending.isEmpty()) {
            throw new LedgerValidationException("Cannot quote work days", offending);
        }
        return wageResolver.totalFor(employee, records.values());
    }

    /**
     * Full read-only scan for paid flags and payments that disagree.
     * May report transient findings if writes are in flight.
     */
    public IntegrityReport validateIntegrity() {
        long startTime = System.currentTimeMillis();
        try {
            return scan().getReport();
        } finally {
            metrics.recordOperationLatency(VALIDATE, System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Brings the ledger back into agreement with its payment records.
     *
     * Payments are trusted: a paid day with no payment is unmarked, and the
     * unpaid days of a payment are marked paid. Payments are never deleted
     * here. Every write is reported as an action, failed ones included.
     */
    public RepairResult repairIntegrity() {
        long startTime = System.currentTimeMillis();
        try {
            IntegrityScan scan = scan();
            IntegrityReport report = scan.getReport();
            if (report.isValid()) {
                log.info("Integrity check passed, no repair needed");
                return new RepairResult(List.of(RepairAction.noRepairNeeded()));
            }

            List<RepairAction> actions = new ArrayList<>();
            for (WorkRecord workDay : report.getOrphanedWorkDays()) {
                actions.add(applyRepair(RepairAction.Type.UNMARKED_ORPHANED_WORK_DAY,
                    workDay.withPaid(false), null,
                    String.format("Unmarked work day %s (%s): marked paid but no payment covers it",
                        workDay.getId(), workDay.getDate())));
            }

            Set<String> markedPaid = new HashSet<>();
            for (PaymentRecord payment : report.getOrphanedPayments()) {
                for (WorkRecord workDay : scan.getUnpaidCoverage().get(payment.getId())) {
                    if (!markedPaid.add(workDay.getId())) {
                        continue;
                    }
                    actions.add(applyRepair(RepairAction.Type.MARKED_COVERED_WORK_DAY_PAID,
                        workDay.withPaid(true), payment.getId(),
                        String.format("Marked work day %s (%s) paid to match payment %s",
                            workDay.getId(), workDay.getDate(), payment.getId())));
                }
            }

            RepairResult result = new RepairResult(List.copyOf(actions));
            if (result.isComplete()) {
                log.info("Integrity repair applied {} action(s)", actions.size());
            } else {
                log.error("Integrity repair finished with failed actions: {}",
                    actions.stream().filter(action -> !action.isSucceeded()).toList());
            }
            return result;
        } finally {
            metrics.recordOperationLatency(REPAIR, System.currentTimeMillis() - startTime);
        }
    }

    // ==================== Scan ====================

    private IntegrityScan scan() {
        CompletableFuture<List<WorkRecord>> workDaysFuture =
            CompletableFuture.supplyAsync(workRecordStore::listAll, scanExecutor);
        CompletableFuture<List<PaymentRecord>> paymentsFuture =
            CompletableFuture.supplyAsync(paymentRecordStore::listAll, scanExecutor);

        List<WorkRecord> workDays;
        List<PaymentRecord> payments;
        try {
            workDays = workDaysFuture.join();
            payments = paymentsFuture.join();
        } catch (CompletionException e) {
            throw new LedgerReadException("Integrity scan could not load records",
                e.getCause() != null ? e.getCause() : e);
        }

        Map<String, WorkRecord> workDaysById = new LinkedHashMap<>();
        workDays.forEach(workDay -> workDaysById.putIfAbsent(workDay.getId(), workDay));

        Map<String, List<String>> claims = new LinkedHashMap<>();
        for (PaymentRecord payment : payments) {
            for (String workDayId : payment.getWorkDayIds()) {
                claims.computeIfAbsent(workDayId, id -> new ArrayList<>()).add(payment.getId());
            }
        }

        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<WorkRecord> orphanedWorkDays = workDaysById.values().stream()
            .filter(WorkRecord::isPaid)
            .filter(workDay -> !claims.containsKey(workDay.getId()))
            .toList();
        orphanedWorkDays.forEach(workDay -> issues.add(String.format(
            "Work day %s (employee %s, %s) is marked paid but no payment covers it",
            workDay.getId(), workDay.getEmployeeId(), workDay.getDate())));

        List<PaymentRecord> orphanedPayments = new ArrayList<>();
        Map<String, List<WorkRecord>> unpaidCoverage = new LinkedHashMap<>();
        for (PaymentRecord payment : payments) {
            List<WorkRecord> unpaid = new ArrayList<>();
            List<String> missing = new ArrayList<>();
            for (String workDayId : payment.getWorkDayIds()) {
                WorkRecord workDay = workDaysById.get(workDayId);
                if (workDay == null) {
                    missing.add(workDayId);
                } else if (!workDay.isPaid()) {
                    unpaid.add(workDay);
                }
            }
            if (!unpaid.isEmpty()) {
                orphanedPayments.add(payment);
                unpaidCoverage.put(payment.getId(), List.copyOf(unpaid));
                issues.add(String.format(
                    "Payment %s (employee %s, %s on %s) covers work day(s) %s that are not marked paid",
                    payment.getId(), payment.getEmployeeId(), payment.getAmount(), payment.getDate(),
                    unpaid.stream().map(WorkRecord::getId).toList()));
            }
            if (!missing.isEmpty()) {
                warnings.add(String.format("Payment %s references work day(s) %s that no longer exist",
                    payment.getId(), missing));
            }
        }

        claims.forEach((workDayId, paymentIds) -> {
            if (paymentIds.size() > 1) {
                warnings.add(String.format("Work day %s is claimed by %d payments: %s",
                    workDayId, paymentIds.size(), paymentIds));
            }
        });

        IntegrityReport report = new IntegrityReport(List.copyOf(orphanedWorkDays), List.copyOf(orphanedPayments),
            List.copyOf(issues), List.copyOf(warnings));
        metrics.recordIntegrityScan(orphanedWorkDays.size(), orphanedPayments.size());
        if (report.isValid()) {
            log.debug("Integrity scan clean: {} work day(s), {} payment(s), {} warning(s)",
                workDays.size(), payments.size(), warnings.size());
        } else {
            log.warn("Integrity scan found {} orphaned work day(s) and {} orphaned payment(s)",
                orphanedWorkDays.size(), orphanedPayments.size());
        }
        return new IntegrityScan(report, unpaidCoverage);
    }

    private RepairAction applyRepair(RepairAction.Type type, WorkRecord repaired, String paymentId,
                                     String description) {
        RepairAction action;
        try {
            workRecordStore.put(repaired);
            action = new RepairAction(type, repaired.getId(), paymentId, description, true, null);
            log.info(description);
        } catch (RuntimeException e) {
            action = new RepairAction(type, repaired.getId(), paymentId, description, false, e.getMessage());
            log.error("Repair write failed for work day {}: {}", repaired.getId(), e.getMessage());
        }
        metrics.recordRepairAction(type.name(), action.isSucceeded());
        return action;
    }

    // ==================== Helpers ====================

    private LedgerException rollBack(CompensatingTransaction saga, RuntimeException cause, FailedStage stage,
                                     Function<SagaReport, LedgerException> rolledBack) {
        SagaReport report = saga.compensate(cause);
        metrics.recordRollback(report.getOperation(), report.getOutcome().name());
        if (report.requiresManualIntervention()) {
            metrics.recordManualIntervention();
            log.error("MANUAL INTERVENTION REQUIRED: {} failed at {} and rollback left records {} inconsistent; "
                    + "completed={}, rolledBack={}, residual={}",
                report.getOperation(), stage, report.residualRecordIds(),
                report.getCompletedSteps(), report.getRolledBackSteps(), report.getResidualSteps());
            return new ManualInterventionRequiredException(stage, report, cause);
        }
        return rolledBack.apply(report);
    }

    private BigDecimal shrunkAmount(PaymentRecord payment, List<String> remaining) {
        if (shrinkAmountPolicy == ShrinkAmountPolicy.RESOLVED) {
            Optional<BigDecimal> resolved = resolvedTotal(payment.getEmployeeId(), remaining);
            if (resolved.isPresent()) {
                return resolved.get();
            }
            log.warn("Cannot resolve pay for the remaining days of payment {}, scaling its amount instead",
                payment.getId());
        }
        return payment.getAmount()
            .multiply(BigDecimal.valueOf(remaining.size()))
            .divide(BigDecimal.valueOf(payment.getWorkDayIds().size()), 2, RoundingMode.HALF_UP);
    }

    private Optional<BigDecimal> resolvedTotal(String employeeId, List<String> workDayIds) {
        Optional<Employee> employee = employeeStore.get(employeeId);
        if (employee.isEmpty()) {
            return Optional.empty();
        }
        List<WorkRecord> records = new ArrayList<>();
        for (String id : workDayIds) {
            Optional<WorkRecord> record = workRecordStore.get(id);
            if (record.isEmpty()) {
                return Optional.empty();
            }
            records.add(record.get());
        }
        return Optional.of(wageResolver.totalFor(employee.get(), records));
    }

    private void validateCreateArguments(CreatePaymentCommand command) {
        if (command.getEmployeeId() == null || command.getEmployeeId().isBlank()) {
            throw new LedgerValidationException("Employee ID is required");
        }
        if (command.getAmount() == null || command.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new LedgerValidationException("Payment amount must be positive");
        }
        if (command.getPaymentType() == null || command.getPaymentType().isBlank()) {
            throw new LedgerValidationException("Payment type is required");
        }
    }

    private void rejectUnpayableDays(String employeeId, List<String> workDayIds, Map<String, WorkRecord> records,
                                     List<PaymentRecord> existingPayments) {
        Map<String, String> offending = new LinkedHashMap<>();
        for (String id : workDayIds) {
            WorkRecord record = records.get(id);
            if (record == null) {
                offending.put(id, "work day not found");
            } else if (!record.isWorked()) {
                offending.put(id, "work day not worked");
            } else if (!employeeId.equals(record.getEmployeeId())) {
                offending.put(id, "belongs to employee " + record.getEmployeeId());
            } else {
                existingPayments.stream()
                    .filter(payment -> payment.covers(id))
                    .findFirst()
                    .ifPresent(payment -> offending.put(id, "already covered by payment " + payment.getId()));
            }
        }
        if (!offending.isEmpty()) {
            throw new LedgerValidationException("Cannot pay for work days", offending);
        }
    }

    private static List<String> requireWorkDayIds(List<String> workDayIds) {
        if (workDayIds == null) {
            throw new LedgerValidationException("At least one work day is required");
        }
        Set<String> distinct = new LinkedHashSet<>();
        workDayIds.stream()
            .filter(Objects::nonNull)
            .forEach(distinct::add);
        List<String> ids = List.copyOf(distinct);
        if (ids.isEmpty()) {
            throw new LedgerValidationException("At least one work day is required");
        }
        return ids;
    }

    private Map<String, WorkRecord> readWorkRecords(List<String> ids, String operation) {
        Map<String, WorkRecord> records = new LinkedHashMap<>();
        for (String id : ids) {
            try {
                workRecordStore.get(id).ifPresent(record -> records.put(id, record));
            } catch (RuntimeException e) {
                throw new LedgerReadException(operation + ": failed to read work day " + id, e);
            }
        }
        return records;
    }

    private List<PaymentRecord> readPayments(String operation) {
        try {
            return paymentRecordStore.listAll();
        } catch (RuntimeException e) {
            throw new LedgerReadException(operation + ": failed to list payments", e);
        }
    }

    private Optional<Employee> readEmployee(String employeeId) {
        if (employeeId == null || employeeId.isBlank()) {
            throw new LedgerValidationException("Employee ID is required");
        }
        try {
            return employeeStore.get(employeeId);
        } catch (RuntimeException e) {
            throw new LedgerReadException("Failed to read employee " + employeeId, e);
        }
    }

    private static ForceUnmarkResult.Failure failure(String recordId, String operation, RuntimeException e) {
        log.warn("Forced unmark could not {} {}: {}", operation, recordId, e.getMessage());
        return new ForceUnmarkResult.Failure(recordId, operation, e.getMessage());
    }

    @Value
    private static class IntegrityScan {
        IntegrityReport report;
        Map<String, List<WorkRecord>> unpaidCoverage;
    }
}
