package com.flagship.payroll_ledger.employee;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/employees")
@RequiredArgsConstructor
public class EmployeeController {

    private final EmployeeStatsService employeeStatsService;

    @GetMapping("/{id}/stats")
    public ResponseEntity<EmployeeStats> getStats(@PathVariable("id") String id) {
        return ResponseEntity.ok(employeeStatsService.statsFor(id));
    }
}
