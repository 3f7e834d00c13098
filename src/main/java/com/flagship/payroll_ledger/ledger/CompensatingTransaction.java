package com.flagship.payroll_ledger.ledger;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Sequence of (forward write, compensating write) pairs for stores that
 * have no multi-document transactions.
 *
 * State machine:
 * - RUNNING: forward steps may be executed
 * - COMMITTED: every step stands
 * - COMPENSATED: every completed step was undone, newest first
 * - COMPENSATION_FAILED: at least one undo failed; the report lists the residue
 *
 * Steps run strictly one after another. A forward step that throws is not
 * recorded as completed, so it is never compensated.
 */
@Slf4j
public class CompensatingTransaction {

    public enum State {
        RUNNING,
        COMMITTED,
        COMPENSATED,
        COMPENSATION_FAILED
    }

    private final String operation;
    private final Deque<PendingStep> completed = new ArrayDeque<>();
    private final List<SagaReport.Step> rolledBack = new ArrayList<>();
    private final List<SagaReport.Step> residual = new ArrayList<>();
    private State state = State.RUNNING;

    public CompensatingTransaction(String operation) {
        this.operation = operation;
    }

    /**
     * Runs {@code forward}; on success remembers {@code compensation} for a later rollback.
     * Exceptions from {@code forward} propagate unchanged.
     */
    public void execute(String description, String recordId, Runnable forward, Runnable compensation) {
        if (state != State.RUNNING) {
            throw new IllegalStateException("Cannot execute step on " + operation + " in " + state + " state");
        }
        forward.run();
        completed.push(new PendingStep(SagaReport.Step.of(description, recordId), compensation));
    }

    public void commit() {
        if (state != State.RUNNING) {
            throw new IllegalStateException("Cannot commit " + operation + " in " + state + " state");
        }
        state = State.COMMITTED;
    }

    /**
     * Undoes every completed step, newest first. A failing undo is recorded
     * and the remaining undos still run.
     *
     * @param cause the failure that triggered the rollback, for logging
     */
    public SagaReport compensate(Throwable cause) {
        if (state != State.RUNNING) {
            throw new IllegalStateException("Cannot compensate " + operation + " in " + state + " state");
        }
        log.warn("Rolling back {} after failure: {} ({} step(s) to undo)",
            operation, cause.getMessage(), completed.size());

        for (PendingStep pending : completed) {
            try {
                pending.getCompensation().run();
                rolledBack.add(pending.getStep());
            } catch (RuntimeException e) {
                log.error("Rollback of '{}' for record {} failed in {}: {}",
                    pending.getStep().getDescription(), pending.getStep().getRecordId(), operation, e.getMessage());
                residual.add(pending.getStep().failedWith(e));
            }
        }
        state = residual.isEmpty() ? State.COMPENSATED : State.COMPENSATION_FAILED;
        return report();
    }

    public State getState() {
        return state;
    }

    public SagaReport report() {
        List<SagaReport.Step> completedSteps = new ArrayList<>();
        completed.descendingIterator().forEachRemaining(pending -> completedSteps.add(pending.getStep()));
        return new SagaReport(operation, state, List.copyOf(completedSteps),
            List.copyOf(rolledBack), List.copyOf(residual));
    }

    @Value
    private static class PendingStep {
        SagaReport.Step step;
        Runnable compensation;
    }
}
