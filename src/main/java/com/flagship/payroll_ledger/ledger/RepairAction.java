package com.flagship.payroll_ledger.ledger;

import lombok.Value;

/**
 * One write performed (or attempted) by integrity repair.
 */
@Value
public class RepairAction {

    public enum Type {
        NO_REPAIR_NEEDED,
        UNMARKED_ORPHANED_WORK_DAY,
        MARKED_COVERED_WORK_DAY_PAID
    }

    Type type;
    String workDayId;
    String paymentId;
    String description;
    boolean succeeded;
    String error;

    static RepairAction noRepairNeeded() {
        return new RepairAction(Type.NO_REPAIR_NEEDED, null, null, "No repair needed", true, null);
    }
}
