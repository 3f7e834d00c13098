package com.flagship.payroll_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * What a compensating sequence did before it stopped.
 *
 * {@code residualSteps} are completed steps whose compensation also failed;
 * their records are left inconsistent until someone repairs them.
 */
@Value
public class SagaReport {
    String operation;
    CompensatingTransaction.State outcome;
    List<Step> completedSteps;
    List<Step> rolledBackSteps;
    List<Step> residualSteps;

    public boolean requiresManualIntervention() {
        return !residualSteps.isEmpty();
    }

    public List<String> residualRecordIds() {
        return residualSteps.stream().map(Step::getRecordId).distinct().toList();
    }

    public List<String> completedRecordIds() {
        return completedSteps.stream().map(Step::getRecordId).distinct().toList();
    }

    public String summary() {
        return String.format("%s %s: %d step(s) completed, %d rolled back, %d residual %s",
            operation, outcome, completedSteps.size(), rolledBackSteps.size(),
            residualSteps.size(), residualRecordIds());
    }

    /**
     * A single forward write, identified by what it did and which record it touched.
     */
    @Value
    public static class Step {
        String description;
        String recordId;
        String error;

        static Step of(String description, String recordId) {
            return new Step(description, recordId, null);
        }

        Step failedWith(Throwable error) {
            return new Step(description, recordId, String.valueOf(error.getMessage()));
        }
    }
}
