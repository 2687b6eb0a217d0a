package com.flagship.finance_ledger.payroll;

import com.flagship.finance_ledger.currency.CurrencyService;
import com.flagship.finance_ledger.exception.DuplicateEntryException;
import com.flagship.finance_ledger.exception.ErrorCode;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.payroll.dto.SalaryRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PayrollServiceTest {

    private PayrollRepository payrollRepository;
    private PayrollService payrollService;

    @BeforeEach
    void setUp() {
        payrollRepository = mock(PayrollRepository.class);
        payrollService = new PayrollService(payrollRepository, mock(CurrencyService.class));

        when(payrollRepository.findEmployee(3L)).thenReturn(Optional.of(Employee.builder().id(3L).fullName("Sara").build()));
        when(payrollRepository.insertSalary(any())).thenReturn(20L);
        when(payrollRepository.findSalary(20L)).thenReturn(Optional.of(Salary.builder().id(20L).build()));
    }

    private static SalaryRequest.SalaryRequestBuilder salary() {
        return SalaryRequest.builder()
            .employeeId(3L)
            .year(2024)
            .month("March")
            .amount(new BigDecimal("15000"));
    }

    private Salary inserted() {
        ArgumentCaptor<Salary> captor = ArgumentCaptor.forClass(Salary.class);
        verify(payrollRepository).insertSalary(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Deductions default to the period's recorded deductions priced at their rates")
    void deductionsDefaultToPeriodSum() {
        when(payrollRepository.sumDeductions(3L, 2024, "March")).thenReturn(new BigDecimal("800"));

        payrollService.createSalary(salary().build());

        assertEquals(0, new BigDecimal("800").compareTo(inserted().getDeductions()));
    }

    @Test
    @DisplayName("Explicit deductions override the period sum")
    void explicitDeductions() {
        payrollService.createSalary(salary().deductions(new BigDecimal("250")).build());

        assertEquals(0, new BigDecimal("250").compareTo(inserted().getDeductions()));
        verify(payrollRepository, never()).sumDeductions(anyLong(), anyInt(), anyString());
    }

    @Test
    @DisplayName("A second salary for the same employee and month is a duplicate")
    void duplicatePeriod() {
        when(payrollRepository.sumDeductions(3L, 2024, "March")).thenReturn(BigDecimal.ZERO);
        doThrow(new DuplicateKeyException("uq_salary_period")).when(payrollRepository).insertSalary(any());

        DuplicateEntryException ex = assertThrows(DuplicateEntryException.class,
            () -> payrollService.createSalary(salary().build()));

        assertEquals(ErrorCode.DUPLICATE_KEY, ex.getCode());
        assertEquals("Salary already exists for employee 3 in March 2024", ex.getMessage());
    }

    @Test
    @DisplayName("A salary for an unknown employee is not found")
    void unknownEmployee() {
        when(payrollRepository.findEmployee(4L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> payrollService.createSalary(salary().employeeId(4L).build()));
        verify(payrollRepository, never()).insertSalary(any());
    }
}
