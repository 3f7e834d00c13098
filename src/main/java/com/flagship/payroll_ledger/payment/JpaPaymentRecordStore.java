package com.flagship.payroll_ledger.payment;

import com.flagship.payroll_ledger.store.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link PaymentRecordStore} over the payments and payment_work_days tables.
 * One short transaction per call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaPaymentRecordStore implements PaymentRecordStore {

    private final PaymentRecordRepository paymentRecordRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<PaymentRecord> get(String id) {
        try {
            return paymentRecordRepository.findById(id).map(PaymentRecordEntity::toDomain);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read payment " + id, e);
        }
    }

    @Override
    @Transactional
    public void put(PaymentRecord record) {
        try {
            PaymentRecordEntity entity = paymentRecordRepository.findById(record.getId())
                .map(existing -> {
                    existing.updateCoverageFromDomain(record);
                    return existing;
                })
                .orElseGet(() -> PaymentRecordEntity.fromDomain(record));
            paymentRecordRepository.saveAndFlush(entity);
            log.debug("Saved payment {} covering {} work day(s)", record.getId(), record.getWorkDayIds().size());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to write payment " + record.getId(), e);
        }
    }

    @Override
    @Transactional
    public void delete(String id) {
        try {
            paymentRecordRepository.deleteById(id);
            paymentRecordRepository.flush();
            log.debug("Deleted payment {}", id);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to delete payment " + id, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<PaymentRecord> listAll() {
        try {
            return paymentRecordRepository.findAll().stream()
                .map(PaymentRecordEntity::toDomain)
                .toList();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to list payments", e);
        }
    }
}
