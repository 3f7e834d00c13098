package com.flagship.payroll_ledger.config;

import com.flagship.payroll_ledger.employee.EmployeeStore;
import com.flagship.payroll_ledger.employee.WageResolver;
import com.flagship.payroll_ledger.ledger.LedgerEngine;
import com.flagship.payroll_ledger.ledger.ShrinkAmountPolicy;
import com.flagship.payroll_ledger.observability.LedgerMetrics;
import com.flagship.payroll_ledger.payment.PaymentRecordStore;
import com.flagship.payroll_ledger.workday.WorkRecordStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the ledger engine to its stores.
 *
 * Properties:
 * - ledger.zone: zone used for "today" when a payment has no date
 * - ledger.shrink.amount-policy: PROPORTIONAL or RESOLVED
 * - ledger.integrity.scan-threads: threads for the scan's parallel reads
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Clock ledgerClock(@Value("${ledger.zone:Europe/London}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService integrityScanExecutor(@Value("${ledger.integrity.scan-threads:2}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("integrity-scan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public LedgerEngine ledgerEngine(WorkRecordStore workRecordStore,
                                     PaymentRecordStore paymentRecordStore,
                                     EmployeeStore employeeStore,
                                     WageResolver wageResolver,
                                     @Value("${ledger.shrink.amount-policy:PROPORTIONAL}") ShrinkAmountPolicy shrinkAmountPolicy,
                                     @Qualifier("integrityScanExecutor") ExecutorService integrityScanExecutor,
                                     Clock ledgerClock,
                                     LedgerMetrics ledgerMetrics) {
        return new LedgerEngine(workRecordStore, paymentRecordStore, employeeStore, wageResolver,
            shrinkAmountPolicy, integrityScanExecutor, ledgerClock, ledgerMetrics);
    }
}
