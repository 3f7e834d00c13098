package com.flagship.payroll_ledger.observability;

import com.flagship.payroll_ledger.ledger.IntegrityReport;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports ledger integrity from the monitor's last scan.
 *
 * DEGRADED rather than DOWN when orphans exist: the service still works,
 * the data needs a repair run.
 */
@Component("ledgerIntegrity")
public class LedgerHealthIndicator implements HealthIndicator {

    private final ObjectProvider<IntegrityMonitor> integrityMonitor;

    public LedgerHealthIndicator(ObjectProvider<IntegrityMonitor> integrityMonitor) {
        this.integrityMonitor = integrityMonitor;
    }

    @Override
    public Health health() {
        IntegrityMonitor monitor = integrityMonitor.getIfAvailable();
        if (monitor == null) {
            return Health.unknown().withDetail("note", "Integrity monitor disabled").build();
        }
        return monitor.getLastScan()
            .map(scan -> {
                IntegrityReport report = scan.getReport();
                Health.Builder builder = report.isValid() ? Health.up() : Health.status("DEGRADED");
                return builder
                    .withDetail("scannedAt", scan.getScannedAt().toString())
                    .withDetail("orphanedWorkDays", report.getOrphanedWorkDays().size())
                    .withDetail("orphanedPayments", report.getOrphanedPayments().size())
                    .withDetail("warnings", report.getWarnings().size())
                    .build();
            })
            .orElseGet(() -> Health.unknown().withDetail("note", "No integrity scan has run yet").build());
    }
}
