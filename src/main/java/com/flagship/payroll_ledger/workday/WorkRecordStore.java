package com.flagship.payroll_ledger.workday;

import java.util.List;
import java.util.Optional;

/**
 * Per-document access to work records.
 *
 * Each call is independent: there are no multi-record transactions and no
 * locking. Failures surface as {@link com.flagship.payroll_ledger.store.StoreException}.
 */
public interface WorkRecordStore {

    Optional<WorkRecord> get(String id);

    /**
     * Inserts or replaces the record with the same id.
     */
    void put(WorkRecord record);

    List<WorkRecord> listAll();
}
