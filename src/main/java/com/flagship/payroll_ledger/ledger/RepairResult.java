package com.flagship.payroll_ledger.ledger;

import lombok.Value;

import java.util.List;

@Value
public class RepairResult {
    List<RepairAction> repairActions;

    public boolean isComplete() {
        return repairActions.stream().allMatch(RepairAction::isSucceeded);
    }

    public boolean isNoOp() {
        return repairActions.stream().allMatch(action -> action.getType() == RepairAction.Type.NO_REPAIR_NEEDED);
    }
}
