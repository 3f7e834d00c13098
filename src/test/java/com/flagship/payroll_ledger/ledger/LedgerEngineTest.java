package com.flagship.payroll_ledger.ledger;

import com.flagship.payroll_ledger.employee.Employee;
import com.flagship.payroll_ledger.employee.WageResolver;
import com.flagship.payroll_ledger.ledger.exception.LedgerReadException;
import com.flagship.payroll_ledger.ledger.exception.LedgerValidationException;
import com.flagship.payroll_ledger.ledger.exception.ManualInterventionRequiredException;
import com.flagship.payroll_ledger.ledger.exception.PartialWriteException;
import com.flagship.payroll_ledger.ledger.exception.PaymentCreateException;
import com.flagship.payroll_ledger.observability.LedgerMetrics;
import com.flagship.payroll_ledger.payment.PaymentRecord;
import com.flagship.payroll_ledger.support.InMemoryEmployeeStore;
import com.flagship.payroll_ledger.support.InMemoryPaymentRecordStore;
import com.flagship.payroll_ledger.support.InMemoryWorkRecordStore;
import com.flagship.payroll_ledger.workday.WorkRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static com.flagship.payroll_ledger.support.Fixtures.EMPLOYEE_ID;
import static com.flagship.payroll_ledger.support.Fixtures.MONDAY;
import static com.flagship.payroll_ledger.support.Fixtures.assertAmount;
import static com.flagship.payroll_ledger.support.Fixtures.employee;
import static com.flagship.payroll_ledger.support.Fixtures.paidDay;
import static com.flagship.payroll_ledger.support.Fixtures.payment;
import static com.flagship.payroll_ledger.support.Fixtures.workedDay;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger engine against in-memory stores with injected write failures.
 */
class LedgerEngineTest {

    private static final Clock CLOCK =
        Clock.fixed(Instant.parse("2024-03-15T09:00:00Z"), ZoneId.of("Europe/London"));

    private InMemoryWorkRecordStore workDays;
    private InMemoryPaymentRecordStore payments;
    private InMemoryEmployeeStore employees;
    private SimpleMeterRegistry registry;
    private LedgerEngine engine;

    @BeforeEach
    void setUp() {
        workDays = new InMemoryWorkRecordStore();
        payments = new InMemoryPaymentRecordStore();
        employees = new InMemoryEmployeeStore().with(employee("50.00"));
        registry = new SimpleMeterRegistry();
        engine = engine(ShrinkAmountPolicy.PROPORTIONAL);
    }

    private LedgerEngine engine(ShrinkAmountPolicy policy) {
        return new LedgerEngine(workDays, payments, employees, new WageResolver(), policy,
            Runnable::run, CLOCK, new LedgerMetrics(registry));
    }

    private CreatePaymentCommand command(String amount, String... workDayIds) {
        return CreatePaymentCommand.builder()
            .employeeId(EMPLOYEE_ID)
            .workDayIds(List.of(workDayIds))
            .amount(new BigDecimal(amount))
            .paymentType("Cash")
            .build();
    }

    @Nested
    @DisplayName("createPaymentAndMark")
    class CreatePayment {

        @BeforeEach
        void days() {
            workDays.with(workedDay("wd-1", 0)).with(workedDay("wd-2", 1)).with(workedDay("wd-3", 2));
        }

        @Test
        @DisplayName("Marks every day paid and stores one payment covering them")
        void marksDaysAndStoresPayment() {
            PaymentRecord payment = engine.createPaymentAndMark(command("150", "wd-1", "wd-2", "wd-3"));

            assertEquals(List.of("wd-1", "wd-2", "wd-3"), payment.getWorkDayIds());
            assertAmount("150", payment.getAmount());
            assertEquals(LocalDate.of(2024, 3, 15), payment.getDate());
            assertEquals(Instant.parse("2024-03-15T09:00:00Z"), payment.getCreatedAt());
            assertTrue(payments.get(payment.getId()).isPresent());
            assertTrue(workDays.require("wd-1").isPaid());
            assertTrue(workDays.require("wd-2").isPaid());
            assertTrue(workDays.require("wd-3").isPaid());
            assertTrue(engine.validateIntegrity().isValid());
        }

        @Test
        @DisplayName("Duplicate ids in the request collapse to one covered day")
        void duplicateIdsCollapse() {
            PaymentRecord payment = engine.createPaymentAndMark(command("100", "wd-1", "wd-2", "wd-1"));

            assertEquals(List.of("wd-1", "wd-2"), payment.getWorkDayIds());
        }

        @Test
        @DisplayName("Rejects a day already covered by another payment without writing anything")
        void rejectsAlreadyCoveredDay() {
            payments.with(payment("pay-old", "50", "wd-2"));
            workDays.with(paidDay("wd-2", 1));

            LedgerValidationException e = assertThrows(LedgerValidationException.class,
                () -> engine.createPaymentAndMark(command("100", "wd-1", "wd-2")));

            assertEquals("already covered by payment pay-old", e.getOffendingIds().get("wd-2"));
            assertFalse(e.getOffendingIds().containsKey("wd-1"));
            assertTrue(workDays.getWrites().isEmpty());
            assertEquals(1, payments.size());
        }

        @Test
        @DisplayName("Lists every offending day with its reason")
        void listsEveryOffendingDay() {
            workDays.with(workedDay("wd-other", 3).toBuilder().employeeId("emp-2").build())
                .with(workedDay("wd-idle", 4).toBuilder().worked(false).build());

            LedgerValidationException e = assertThrows(LedgerValidationException.class,
                () -> engine.createPaymentAndMark(command("100", "wd-missing", "wd-other", "wd-idle")));

            assertEquals("work day not found", e.getOffendingIds().get("wd-missing"));
            assertEquals("belongs to employee emp-2", e.getOffendingIds().get("wd-other"));
            assertEquals("work day not worked", e.getOffendingIds().get("wd-idle"));
            assertTrue(workDays.getWrites().isEmpty());
        }

        @Test
        @DisplayName("Rejects a non-positive amount and an empty selection")
        void rejectsBadArguments() {
            assertThrows(LedgerValidationException.class, () -> engine.createPaymentAndMark(command("0", "wd-1")));
            assertThrows(LedgerValidationException.class, () -> engine.createPaymentAndMark(command("10")));
            assertEquals(0, payments.size());
        }

        @Test
        @DisplayName("Payment write failure rolls back every mark")
        void paymentWriteFailureRollsBack() {
            payments.failPut(true);

            PaymentCreateException e = assertThrows(PaymentCreateException.class,
                () -> engine.createPaymentAndMark(command("100", "wd-1", "wd-2")));

            assertEquals(CompensatingTransaction.State.COMPENSATED, e.getReport().getOutcome());
            assertFalse(workDays.require("wd-1").isPaid());
            assertFalse(workDays.require("wd-2").isPaid());
            assertEquals(0, payments.size());
            assertTrue(engine.validateIntegrity().isValid());
        }

        @Test
        @DisplayName("Marking failure part way restores the days already marked")
        void markFailureRestoresEarlierDays() {
            workDays.failPutWhen(record -> record.getId().equals("wd-2") && record.isPaid());

            PartialWriteException e = assertThrows(PartialWriteException.class,
                () -> engine.createPaymentAndMark(command("100", "wd-1", "wd-2", "wd-3")));

            assertEquals(List.of("wd-1"), e.getReport().completedRecordIds());
            assertFalse(workDays.require("wd-1").isPaid());
            assertFalse(workDays.require("wd-2").isPaid());
            assertFalse(workDays.require("wd-3").isPaid());
            assertEquals(0, payments.size());
        }

        @Test
        @DisplayName("Failed rollback reports the residual days and counts a manual intervention")
        void failedRollbackRequiresManualIntervention() {
            payments.failPut(true);
            workDays.failPutWhen(record -> record.getId().equals("wd-1") && !record.isPaid());

            ManualInterventionRequiredException e = assertThrows(ManualInterventionRequiredException.class,
                () -> engine.createPaymentAndMark(command("100", "wd-1", "wd-2")));

            assertEquals(ManualInterventionRequiredException.FailedStage.CREATE_PAYMENT, e.getFailedStage());
            assertEquals(List.of("wd-1"), e.getResidualIds());
            assertTrue(workDays.require("wd-1").isPaid());
            assertFalse(workDays.require("wd-2").isPaid());
            assertEquals(1.0, registry.get("ledger.manual_intervention").counter().count());

            IntegrityReport report = engine.validateIntegrity();
            assertEquals(List.of("wd-1"), report.getOrphanedWorkDays().stream().map(WorkRecord::getId).toList());
        }
    }

    @Nested
    @DisplayName("unmarkAsPaid")
    class Unmark {

        @Test
        @DisplayName("Asks for confirmation and writes nothing when a payment covers a day")
        void requiresConfirmationForCoveredDays() {
            workDays.with(paidDay("wd-1", 0)).with(paidDay("wd-2", 1)).with(paidDay("wd-3", 2));
            payments.with(payment("pay-1", "150", "wd-1", "wd-2", "wd-3"));

            UnmarkResult result = engine.unmarkAsPaid(List.of("wd-2"));

            assertFalse(result.isApplied());
            assertTrue(result.isRequiresConfirmation());
            assertEquals("pay-1", result.getAffectedPayments().get(0).getId());
            assertTrue(result.getMessage().contains("£150.00 by Cash on 2024-03-11 covering 3 day(s)"),
                result.getMessage());
            assertTrue(workDays.getWrites().isEmpty());
        }

        @Test
        @DisplayName("Unmarks days no payment covers")
        void unmarksUncoveredDays() {
            workDays.with(paidDay("wd-1", 0)).with(paidDay("wd-2", 1));

            UnmarkResult result = engine.unmarkAsPaid(List.of("wd-1", "wd-2"));

            assertTrue(result.isApplied());
            assertEquals(List.of("wd-1", "wd-2"), result.getUnmarkedWorkDayIds());
            assertFalse(workDays.require("wd-1").isPaid());
            assertFalse(workDays.require("wd-2").isPaid());
        }

        @Test
        @DisplayName("Rejects unknown days and empty selections")
        void rejectsUnknownDays() {
            LedgerValidationException e = assertThrows(LedgerValidationException.class,
                () -> engine.unmarkAsPaid(List.of("wd-missing")));
            assertEquals("work day not found", e.getOffendingIds().get("wd-missing"));

            assertThrows(LedgerValidationException.class, () -> engine.unmarkAsPaid(List.of()));
        }

        @Test
        @DisplayName("Write failure restores the days already unmarked")
        void writeFailureRestores() {
            workDays.with(paidDay("wd-1", 0)).with(paidDay("wd-2", 1));
            workDays.failPutWhen(record -> record.getId().equals("wd-2") && !record.isPaid());

            assertThrows(PartialWriteException.class, () -> engine.unmarkAsPaid(List.of("wd-1", "wd-2")));

            assertTrue(workDays.require("wd-1").isPaid());
            assertTrue(workDays.require("wd-2").isPaid());
        }
    }

    @Nested
    @DisplayName("forceUnmarkAsPaid")
    class ForceUnmark {

        @Test
        @DisplayName("Shrinking a two-day payment of 100 by one day leaves 50")
        void shrinkHalvesAmount() {
            workDays.with(paidDay("wd-1", 0)).with(paidDay("wd-2", 1));
            payments.with(payment("pay-1", "100", "wd-1", "wd-2"));

            ForceUnmarkResult result = engine.forceUnmarkAsPaid(List.of("wd-1"), ResolutionPolicy.SHRINK);

            assertTrue(result.isComplete());
            PaymentRecord shrunk = payments.get("pay-1").orElseThrow();
            assertEquals(List.of("wd-2"), shrunk.getWorkDayIds());
            assertAmount("50", shrunk.getAmount());
            assertFalse(workDays.require("wd-1").isPaid());
            assertTrue(workDays.require("wd-2").isPaid());
            assertTrue(engine.validateIntegrity().isValid());
        }

        @Test
        @DisplayName("Paying three days at 50 then shrinking one away leaves 100 over two days")
        void createThenShrink() {
            workDays.with(workedDay("wd-1", 0)).with(workedDay("wd-2", 1)).with(workedDay("wd-3", 2));
            PaymentRecord created = engine.createPaymentAndMark(command("150", "wd-1", "wd-2", "wd-3"));

            UnmarkResult guarded = engine.unmarkAsPaid(List.of("wd-2"));
            assertTrue(guarded.isRequiresConfirmation());

            ForceUnmarkResult result = engine.forceUnmarkAsPaid(List.of("wd-2"), ResolutionPolicy.SHRINK);

            assertEquals(1, result.getUpdatedPayments().size());
            PaymentRecord shrunk = payments.get(created.getId()).orElseThrow();
            assertEquals(List.of("wd-1", "wd-3"), shrunk.getWorkDayIds());
            assertAmount("100", shrunk.getAmount());
            assertTrue(engine.validateIntegrity().isValid());
        }

        @Test
        @DisplayName("A payment left with no days is deleted even when shrinking")
        void emptiedPaymentIsDeleted() {
            workDays.with(paidDay("wd-1", 0));
            payments.with(payment("pay-1", "50", "wd-1"));

            ForceUnmarkResult result = engine.forceUnmarkAsPaid(List.of("wd-1"), ResolutionPolicy.SHRINK);

            assertEquals(List.of("pay-1"), result.getDeletedPaymentIds());
            assertTrue(payments.get("pay-1").isEmpty());
            assertFalse(workDays.require("wd-1").isPaid());
        }

        @Test
        @DisplayName("DELETE removes the whole payment and unmarks only the selected days")
        void deletePolicyRemovesPayment() {
            workDays.with(paidDay("wd-1", 0)).with(paidDay("wd-2", 1));
            payments.with(payment("pay-1", "100", "wd-1", "wd-2"));

            ForceUnmarkResult result = engine.forceUnmarkAsPaid(List.of("wd-1"), ResolutionPolicy.DELETE);

            assertEquals(List.of("pay-1"), result.getDeletedPaymentIds());
            assertEquals(List.of("wd-1"), result.getUnmarkedWorkDayIds());
            assertEquals(0, payments.size());
            assertTrue(workDays.require("wd-2").isPaid());
        }

        @Test
        @DisplayName("Resolved shrink prices the remaining days through the wage resolver")
        void resolvedShrinkUsesWages() {
            workDays.with(paidDay("wd-1", 0))
                .with(paidDay("wd-2", 1).toBuilder().customAmount(new BigDecimal("80")).build());
            payments.with(payment("pay-1", "120", "wd-1", "wd-2"));

            engine(ShrinkAmountPolicy.RESOLVED).forceUnmarkAsPaid(List.of("wd-1"), ResolutionPolicy.SHRINK);

            assertAmount("80", payments.get("pay-1").orElseThrow().getAmount());
        }

        @Test
        @DisplayName("Failed writes are listed and the remaining writes still run")
        void collectsFailures() {
            workDays.with(paidDay("wd-1", 0)).with(paidDay("wd-2", 1));
            payments.with(payment("pay-1", "100", "wd-1", "wd-2"));
            payments.failPut(true);

            ForceUnmarkResult result = engine.forceUnmarkAsPaid(List.of("wd-1", "wd-missing"), ResolutionPolicy.SHRINK);

            assertFalse(result.isComplete());
            assertEquals(List.of("pay-1", "wd-missing"),
                result.getFailures().stream().map(ForceUnmarkResult.Failure::getRecordId).toList());
            assertEquals(List.of("wd-1"), result.getUnmarkedWorkDayIds());
            assertFalse(workDays.require("wd-1").isPaid());
            assertFalse(engine.validateIntegrity().isValid());
        }

        @Test
        @DisplayName("A resolution policy is required")
        void requiresPolicy() {
            assertThrows(LedgerValidationException.class, () -> engine.forceUnmarkAsPaid(List.of("wd-1"), null));
        }
    }

    @Nested
    @DisplayName("deletePayment and quoteAmount")
    class DeleteAndQuote {

        @Test
        @DisplayName("Deleting a payment unmarks every day it covered")
        void deleteUnmarksCoveredDays() {
            workDays.with(paidDay("wd-1", 0)).with(paidDay("wd-2", 1));
            payments.with(payment("pay-1", "100", "wd-1", "wd-2"));

            ForceUnmarkResult result = engine.deletePayment("pay-1");

            assertTrue(result.isComplete());
            assertEquals(0, payments.size());
            assertFalse(workDays.require("wd-1").isPaid());
            assertFalse(workDays.require("wd-2").isPaid());
        }

        @Test
        @DisplayName("Deleting an unknown payment is a validation error")
        void deleteUnknownPayment() {
            assertThrows(LedgerValidationException.class, () -> engine.deletePayment("pay-missing"));
        }

        @Test
        @DisplayName("Quote applies the previous wage before the change date")
        void quoteUsesWageHistory() {
            employees.with(Employee.builder()
                .id(EMPLOYEE_ID)
                .name("Sam Carter")
                .dailyWage(new BigDecimal("60"))
                .previousWage(new BigDecimal("50"))
                .wageChangeDate(MONDAY.plusDays(1))
                .build());
            workDays.with(workedDay("wd-1", 0)).with(workedDay("wd-2", 1));

            assertAmount("110", engine.quoteAmount(EMPLOYEE_ID, List.of("wd-1", "wd-2")));
        }
    }

    @Nested
    @DisplayName("validateIntegrity")
    class Integrity {

        @Test
        @DisplayName("Finds paid days with no payment and payments over unpaid days")
        void findsBothOrphanKinds() {
            workDays.with(paidDay("wd-orphan", 0)).with(workedDay("wd-unpaid", 1)).with(paidDay("wd-ok", 2));
            payments.with(payment("pay-1", "100", "wd-unpaid", "wd-ok"));

            IntegrityReport report = engine.validateIntegrity();

            assertFalse(report.isValid());
            assertEquals(List.of("wd-orphan"), report.getOrphanedWorkDays().stream().map(WorkRecord::getId).toList());
            assertEquals(List.of("pay-1"), report.getOrphanedPayments().stream().map(PaymentRecord::getId).toList());
            assertEquals(2, report.getIssues().size());
            assertEquals(1.0, registry.get("ledger.integrity.orphaned_work_days").gauge().value());
        }

        @Test
        @DisplayName("Missing references and double claims are warnings, not issues")
        void warnings() {
            workDays.with(paidDay("wd-1", 0));
            payments.with(payment("pay-1", "50", "wd-1", "wd-gone")).with(payment("pay-2", "50", "wd-1"));

            IntegrityReport report = engine.validateIntegrity();

            assertTrue(report.isValid());
            assertEquals(2, report.getWarnings().size());
        }

        @Test
        @DisplayName("A store read failure surfaces as a read error")
        void readFailure() {
            payments.failReads(true);

            assertThrows(LedgerReadException.class, () -> engine.validateIntegrity());
        }
    }

    @Nested
    @DisplayName("repairIntegrity")
    class Repair {

        @Test
        @DisplayName("Trusts payments: unmarks orphaned days and marks covered days paid")
        void repairIsAsymmetric() {
            workDays.with(paidDay("wd-orphan", 0)).with(workedDay("wd-unpaid", 1));
            payments.with(payment("pay-1", "50", "wd-unpaid"));

            RepairResult result = engine.repairIntegrity();

            assertTrue(result.isComplete());
            assertEquals(List.of(RepairAction.Type.UNMARKED_ORPHANED_WORK_DAY,
                    RepairAction.Type.MARKED_COVERED_WORK_DAY_PAID),
                result.getRepairActions().stream().map(RepairAction::getType).toList());
            assertFalse(workDays.require("wd-orphan").isPaid());
            assertTrue(workDays.require("wd-unpaid").isPaid());
            assertEquals(1, payments.size());
            assertTrue(engine.validateIntegrity().isValid());
        }

        @Test
        @DisplayName("Running repair twice changes nothing the second time")
        void repairIsIdempotent() {
            workDays.with(paidDay("wd-orphan", 0));

            engine.repairIntegrity();
            int writes = workDays.getWrites().size();
            RepairResult second = engine.repairIntegrity();

            assertTrue(second.isNoOp());
            assertEquals(writes, workDays.getWrites().size());
        }

        @Test
        @DisplayName("A failed repair write is reported and the others still apply")
        void failedRepairWriteIsReported() {
            workDays.with(paidDay("wd-a", 0)).with(paidDay("wd-b", 1));
            workDays.failPutWhen(record -> record.getId().equals("wd-a"));

            RepairResult result = engine.repairIntegrity();

            assertFalse(result.isComplete());
            assertEquals(2, result.getRepairActions().size());
            assertFalse(workDays.require("wd-b").isPaid());
            assertTrue(workDays.require("wd-a").isPaid());
        }
    }
}
