package com.flagship.payroll_ledger.workday;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WorkRecordRepository extends JpaRepository<WorkRecordEntity, String> {
}
