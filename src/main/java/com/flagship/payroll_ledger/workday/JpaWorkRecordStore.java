package com.flagship.payroll_ledger.workday;

import com.flagship.payroll_ledger.store.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link WorkRecordStore} over the work_days table.
 *
 * Every method runs in its own short transaction, so a put is a single
 * document write just like the document store the ledger was designed for.
 * Writes are flushed inside the method so constraint violations surface as
 * {@link StoreException} rather than at commit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaWorkRecordStore implements WorkRecordStore {

    private final WorkRecordRepository workRecordRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkRecord> get(String id) {
        try {
            return workRecordRepository.findById(id).map(WorkRecordEntity::toDomain);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read work day " + id, e);
        }
    }

    @Override
    @Transactional
    public void put(WorkRecord record) {
        try {
            WorkRecordEntity entity = workRecordRepository.findById(record.getId())
                .map(existing -> {
                    existing.updateFromDomain(record);
                    return existing;
                })
                .orElseGet(() -> WorkRecordEntity.fromDomain(record));
            workRecordRepository.saveAndFlush(entity);
            log.debug("Saved work day {} (worked={}, paid={})", record.getId(), record.isWorked(), record.isPaid());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to write work day " + record.getId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<WorkRecord> listAll() {
        try {
            return workRecordRepository.findAll().stream()
                .map(WorkRecordEntity::toDomain)
                .toList();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to list work days", e);
        }
    }
}
