package com.flagship.payroll_ledger.payment;

import java.util.List;
import java.util.Optional;

/**
 * Per-document access to payment records. Same limits as the work record
 * store: no multi-record transactions, no locking.
 */
public interface PaymentRecordStore {

    Optional<PaymentRecord> get(String id);

    /**
     * Inserts or replaces the record with the same id.
     */
    void put(PaymentRecord record);

    void delete(String id);

    List<PaymentRecord> listAll();
}
