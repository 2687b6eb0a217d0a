package com.flagship.finance_ledger.payroll;

import com.flagship.finance_ledger.command.CommandHandler;
import com.flagship.finance_ledger.command.CommandModule;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.payroll.dto.DeductionRequest;
import com.flagship.finance_ledger.payroll.dto.EmployeeRequest;
import com.flagship.finance_ledger.payroll.dto.SalaryRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class PayrollCommands implements CommandModule {

    private final PayrollService payrollService;

    @Override
    public Map<String, CommandHandler> commands() {
        Map<String, CommandHandler> commands = new LinkedHashMap<>();
        commands.put("create_employee", p -> payrollService.createEmployee(p.as(EmployeeRequest.class)));
        commands.put("update_employee", p ->
            payrollService.updateEmployee(p.id("id"), p.as(EmployeeRequest.class)));
        commands.put("delete_employee", p -> {
            payrollService.deleteEmployee(p.id("id"));
            return CommandHandler.message("Employee deleted");
        });
        commands.put("get_employee", p -> payrollService.getEmployee(p.id("id")));
        commands.put("get_employees", p -> payrollService.listEmployees(p.page()));

        commands.put("create_salary", p -> payrollService.createSalary(p.as(SalaryRequest.class)));
        commands.put("update_salary", p -> payrollService.updateSalary(p.id("id"), p.as(SalaryRequest.class)));
        commands.put("delete_salary", p -> {
            payrollService.deleteSalary(p.id("id"));
            return CommandHandler.message("Salary deleted");
        });
        commands.put("get_salary", p -> payrollService.getSalary(p.id("id")));
        commands.put("get_salaries", p -> payrollService.listSalaries(p.page()));
        commands.put("get_salaries_by_employee", p -> payrollService.getSalariesByEmployee(p.id("employee_id")));

        commands.put("create_deduction", p -> payrollService.createDeduction(p.as(DeductionRequest.class)));
        commands.put("update_deduction", p ->
            payrollService.updateDeduction(p.id("id"), p.as(DeductionRequest.class)));
        commands.put("delete_deduction", p -> {
            payrollService.deleteDeduction(p.id("id"));
            return CommandHandler.message("Deduction deleted");
        });
        commands.put("get_deduction", p -> payrollService.getDeduction(p.id("id")));
        commands.put("get_deductions", p -> payrollService.listDeductions(p.page()));
        commands.put("get_deductions_by_employee", p -> payrollService.getDeductionsByEmployee(p.id("employee_id")));
        commands.put("get_deductions_by_employee_year_month", p -> {
            int year = p.optionalInt("year").orElseThrow(() -> new ValidationFailedException("year is required"));
            return payrollService.getDeductionsByPeriod(p.id("employee_id"), year, p.requiredText("month"));
        });
        return commands;
    }
}
