package com.flagship.payroll_ledger.observability;

import com.flagship.payroll_ledger.ledger.IntegrityReport;
import com.flagship.payroll_ledger.ledger.LedgerEngine;
import com.flagship.payroll_ledger.ledger.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic read-only integrity scan.
 *
 * Feeds the integrity gauges and the health indicator. It never repairs:
 * repair stays an explicit operator action.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "ledger.integrity.monitor.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class IntegrityMonitor {

    private final LedgerEngine ledgerEngine;
    private final AtomicReference<LastScan> lastScan = new AtomicReference<>();

    @Scheduled(initialDelayString = "${ledger.integrity.monitor.initial-delay-ms:30000}",
               fixedDelayString = "${ledger.integrity.monitor.interval-ms:300000}")
    public void scan() {
        try {
            IntegrityReport report = ledgerEngine.validateIntegrity();
            lastScan.set(new LastScan(report, Instant.now()));
            if (!report.isValid()) {
                log.warn("Scheduled integrity scan found {} issue(s); run integrity repair to fix: {}",
                    report.getIssues().size(), report.getIssues());
            }
        } catch (LedgerException e) {
            log.error("Scheduled integrity scan failed", e);
        }
    }

    public Optional<LastScan> getLastScan() {
        return Optional.ofNullable(lastScan.get());
    }

    @lombok.Value
    public static class LastScan {
        IntegrityReport report;
        Instant scannedAt;
    }
}
