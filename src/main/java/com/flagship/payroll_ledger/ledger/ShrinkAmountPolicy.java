package com.flagship.payroll_ledger.ledger;

/**
 * How a shrunk payment's amount is recomputed.
 */
public enum ShrinkAmountPolicy {
    /**
     * Scale the old amount by remaining days / original days.
     * Drifts from the true per-day total when custom amounts are involved.
     */
    PROPORTIONAL,
    /**
     * Sum the resolved pay of each remaining day.
     */
    RESOLVED
}
