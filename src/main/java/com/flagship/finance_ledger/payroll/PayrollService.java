package com.flagship.finance_ledger.payroll;

import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.common.PageQuery;
import com.flagship.finance_ledger.common.PagedResult;
import com.flagship.finance_ledger.currency.Currency;
import com.flagship.finance_ledger.currency.CurrencyService;
import com.flagship.finance_ledger.exception.DuplicateEntryException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.payroll.dto.DeductionRequest;
import com.flagship.finance_ledger.payroll.dto.EmployeeRequest;
import com.flagship.finance_ledger.payroll.dto.SalaryRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Employees, monthly salaries and salary deductions. Payroll records do not
 * move account balances.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayrollService {

    private final PayrollRepository payrollRepository;
    private final CurrencyService currencyService;

    // ==================== Employees ====================

    @Transactional
    public Employee createEmployee(EmployeeRequest request) {
        validate(request);
        long id = payrollRepository.insertEmployee(toEmployee(null, request));
        log.info("Employee created: id={}", id);
        return getEmployee(id);
    }

    @Transactional
    public Employee updateEmployee(long id, EmployeeRequest request) {
        getEmployee(id);
        validate(request);
        payrollRepository.updateEmployee(toEmployee(id, request));
        return getEmployee(id);
    }

    /**
     * Deletes an employee together with their salaries and deductions.
     */
    @Transactional
    public void deleteEmployee(long id) {
        getEmployee(id);
        payrollRepository.deleteEmployee(id);
        log.info("Employee deleted: id={}", id);
    }

    @Transactional(readOnly = true)
    public Employee getEmployee(long id) {
        return payrollRepository.findEmployee(id).orElseThrow(() -> NotFoundException.of("Employee", id));
    }

    @Transactional(readOnly = true)
    public PagedResult<Employee> listEmployees(PageQuery query) {
        return PagedResult.of(payrollRepository.findEmployees(query), payrollRepository.countEmployees(query), query);
    }

    // ==================== Salaries ====================

    @Transactional
    public Salary createSalary(SalaryRequest request) {
        Salary salary = toSalary(null, request);
        try {
            long id = payrollRepository.insertSalary(salary);
            log.info("Salary created: id={}, employee={}, period={} {}", id, salary.getEmployeeId(),
                salary.getMonth(), salary.getYear());
            return getSalary(id);
        } catch (DuplicateKeyException e) {
            throw duplicateSalary(salary);
        }
    }

    @Transactional
    public Salary updateSalary(long id, SalaryRequest request) {
        getSalary(id);
        Salary salary = toSalary(id, request);
        try {
            payrollRepository.updateSalary(salary);
        } catch (DuplicateKeyException e) {
            throw duplicateSalary(salary);
        }
        return getSalary(id);
    }

    @Transactional
    public void deleteSalary(long id) {
        getSalary(id);
        payrollRepository.deleteSalary(id);
    }

    @Transactional(readOnly = true)
    public Salary getSalary(long id) {
        return payrollRepository.findSalary(id).orElseThrow(() -> NotFoundException.of("Salary", id));
    }

    @Transactional(readOnly = true)
    public PagedResult<Salary> listSalaries(PageQuery query) {
        return PagedResult.of(payrollRepository.findSalaries(query), payrollRepository.countSalaries(), query);
    }

    @Transactional(readOnly = true)
    public List<Salary> getSalariesByEmployee(long employeeId) {
        getEmployee(employeeId);
        return payrollRepository.findSalariesByEmployee(employeeId);
    }

    // ==================== Deductions ====================

    @Transactional
    public Deduction createDeduction(DeductionRequest request) {
        long id = payrollRepository.insertDeduction(toDeduction(null, request));
        return getDeduction(id);
    }

    @Transactional
    public Deduction updateDeduction(long id, DeductionRequest request) {
        getDeduction(id);
        payrollRepository.updateDeduction(toDeduction(id, request));
        return getDeduction(id);
    }

    @Transactional
    public void deleteDeduction(long id) {
        getDeduction(id);
        payrollRepository.deleteDeduction(id);
    }

    @Transactional(readOnly = true)
    public Deduction getDeduction(long id) {
        return payrollRepository.findDeduction(id).orElseThrow(() -> NotFoundException.of("Deduction", id));
    }

    @Transactional(readOnly = true)
    public PagedResult<Deduction> listDeductions(PageQuery query) {
        return PagedResult.of(payrollRepository.findDeductions(query), payrollRepository.countDeductions(), query);
    }

    @Transactional(readOnly = true)
    public List<Deduction> getDeductionsByEmployee(long employeeId) {
        getEmployee(employeeId);
        return payrollRepository.findDeductionsByEmployee(employeeId);
    }

    @Transactional(readOnly = true)
    public List<Deduction> getDeductionsByPeriod(long employeeId, int year, String month) {
        getEmployee(employeeId);
        return payrollRepository.findDeductionsByPeriod(employeeId, year, month);
    }

    private Salary toSalary(Long id, SalaryRequest request) {
        if (request.getEmployeeId() == null || request.getYear() == null || isBlank(request.getMonth())) {
            throw new ValidationFailedException("Employee, year and month are required");
        }
        if (request.getAmount() == null || request.getAmount().signum() < 0) {
            throw new ValidationFailedException("Amount cannot be negative");
        }
        getEmployee(request.getEmployeeId());
        BigDecimal deductions = request.getDeductions() != null
            ? request.getDeductions()
            : payrollRepository.sumDeductions(request.getEmployeeId(), request.getYear(), request.getMonth());
        return Salary.builder()
            .id(id)
            .employeeId(request.getEmployeeId())
            .year(request.getYear())
            .month(request.getMonth())
            .amount(request.getAmount())
            .deductions(Money.round6(deductions))
            .notes(request.getNotes())
            .build();
    }

    private Deduction toDeduction(Long id, DeductionRequest request) {
        if (request.getEmployeeId() == null || request.getYear() == null || isBlank(request.getMonth())) {
            throw new ValidationFailedException("Employee, year and month are required");
        }
        if (!Money.isPositive(request.getAmount())) {
            throw new ValidationFailedException("Amount must be greater than 0");
        }
        getEmployee(request.getEmployeeId());
        Currency currency = currencyService.requireByName(request.getCurrency());
        BigDecimal rate = request.getRate() != null ? request.getRate() : currency.getRate();
        return Deduction.builder()
            .id(id)
            .employeeId(request.getEmployeeId())
            .year(request.getYear())
            .month(request.getMonth())
            .currency(currency.getName())
            .rate(rate)
            .amount(request.getAmount())
            .build();
    }

    private static DuplicateEntryException duplicateSalary(Salary salary) {
        return new DuplicateEntryException("Salary already exists for employee " + salary.getEmployeeId()
            + " in " + salary.getMonth() + " " + salary.getYear());
    }

    private static void validate(EmployeeRequest request) {
        if (isBlank(request.getFullName()) || isBlank(request.getPhone()) || isBlank(request.getAddress())) {
            throw new ValidationFailedException("Full name, phone and address are required");
        }
    }

    private static Employee toEmployee(Long id, EmployeeRequest request) {
        return Employee.builder()
            .id(id)
            .fullName(request.getFullName().trim())
            .phone(request.getPhone().trim())
            .email(request.getEmail())
            .address(request.getAddress().trim())
            .position(request.getPosition())
            .hireDate(request.getHireDate())
            .baseSalary(request.getBaseSalary())
            .notes(request.getNotes())
            .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
