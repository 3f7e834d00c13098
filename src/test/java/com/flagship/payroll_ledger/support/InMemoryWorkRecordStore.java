package com.flagship.payroll_ledger.support;

import com.flagship.payroll_ledger.store.StoreException;
import com.flagship.payroll_ledger.workday.WorkRecord;
import com.flagship.payroll_ledger.workday.WorkRecordStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Work record store backed by a map, with injectable write and read failures.
 */
public class InMemoryWorkRecordStore implements WorkRecordStore {

    private final Map<String, WorkRecord> records = new LinkedHashMap<>();
    private final List<WorkRecord> writes = new ArrayList<>();
    private Predicate<WorkRecord> failPut = record -> false;
    private boolean failReads;

    public InMemoryWorkRecordStore with(WorkRecord record) {
        records.put(record.getId(), record);
        return this;
    }

    /**
     * Every put whose record matches {@code predicate} throws a {@link StoreException}.
     */
    public void failPutWhen(Predicate<WorkRecord> predicate) {
        this.failPut = predicate;
    }

    public void failReads(boolean failReads) {
        this.failReads = failReads;
    }

    public WorkRecord require(String id) {
        WorkRecord record = records.get(id);
        if (record == null) {
            throw new AssertionError("No work record " + id);
        }
        return record;
    }

    public List<WorkRecord> getWrites() {
        return writes;
    }

    @Override
    public Optional<WorkRecord> get(String id) {
        if (failReads) {
            throw new StoreException("work_days unavailable");
        }
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public void put(WorkRecord record) {
        if (failPut.test(record)) {
            throw new StoreException("write rejected for work day " + record.getId());
        }
        records.put(record.getId(), record);
        writes.add(record);
    }

    @Override
    public List<WorkRecord> listAll() {
        if (failReads) {
            throw new StoreException("work_days unavailable");
        }
        return List.copyOf(records.values());
    }
}
