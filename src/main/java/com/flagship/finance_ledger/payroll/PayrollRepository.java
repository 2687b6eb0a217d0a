package com.flagship.finance_ledger.payroll;

import com.flagship.finance_ledger.common.PageQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC access to employees, salaries and deductions.
 */
@Repository
@RequiredArgsConstructor
public class PayrollRepository {

    private static final String EMPLOYEE_COLUMNS =
        "SELECT id, full_name, phone, email, address, position, hire_date, base_salary, notes FROM employees";
    private static final String SALARY_COLUMNS =
        "SELECT id, employee_id, year, month, amount, deductions, notes FROM salaries";
    private static final String DEDUCTION_COLUMNS =
        "SELECT id, employee_id, year, month, currency, rate, amount FROM deductions";
    private static final Set<String> EMPLOYEE_SORTABLE = Set.of("full_name", "hire_date", "created_at");
    private static final Set<String> PERIOD_SORTABLE = Set.of("year", "amount", "created_at");

    private final JdbcTemplate jdbcTemplate;

    // ==================== Employees ====================

    public Optional<Employee> findEmployee(long id) {
        return jdbcTemplate.query(EMPLOYEE_COLUMNS + " WHERE id = ?", employeeRowMapper(), id).stream().findFirst();
    }

    public List<Employee> findEmployees(PageQuery query) {
        List<Object> args = new ArrayList<>();
        String where = "";
        if (query.hasSearch()) {
            where = " WHERE LOWER(full_name) LIKE ? OR LOWER(phone) LIKE ? OR LOWER(COALESCE(position, '')) LIKE ?";
            args.add(query.searchPattern());
            args.add(query.searchPattern());
            args.add(query.searchPattern());
        }
        args.add(query.getPerPage());
        args.add(query.offset());
        return jdbcTemplate.query(
            EMPLOYEE_COLUMNS + where + query.orderBy(EMPLOYEE_SORTABLE, "full_name") + " LIMIT ? OFFSET ?",
            employeeRowMapper(), args.toArray());
    }

    public long countEmployees(PageQuery query) {
        if (!query.hasSearch()) {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM employees", Long.class);
            return count != null ? count : 0L;
        }
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM employees WHERE LOWER(full_name) LIKE ? OR LOWER(phone) LIKE ? " +
            "OR LOWER(COALESCE(position, '')) LIKE ?",
            Long.class, query.searchPattern(), query.searchPattern(), query.searchPattern());
        return count != null ? count : 0L;
    }

    public long insertEmployee(Employee employee) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO employees (full_name, phone, email, address, position, hire_date, base_salary, notes) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            employee.getFullName(), employee.getPhone(), employee.getEmail(), employee.getAddress(),
            employee.getPosition(), employee.getHireDate(), employee.getBaseSalary(), employee.getNotes());
    }

    public int updateEmployee(Employee employee) {
        return jdbcTemplate.update(
            "UPDATE employees SET full_name = ?, phone = ?, email = ?, address = ?, position = ?, hire_date = ?, " +
            "base_salary = ?, notes = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            employee.getFullName(), employee.getPhone(), employee.getEmail(), employee.getAddress(),
            employee.getPosition(), employee.getHireDate(), employee.getBaseSalary(), employee.getNotes(),
            employee.getId());
    }

    public int deleteEmployee(long id) {
        return jdbcTemplate.update("DELETE FROM employees WHERE id = ?", id);
    }

    // ==================== Salaries ====================

    public Optional<Salary> findSalary(long id) {
        return jdbcTemplate.query(SALARY_COLUMNS + " WHERE id = ?", salaryRowMapper(), id).stream().findFirst();
    }

    public List<Salary> findSalaries(PageQuery query) {
        return jdbcTemplate.query(
            SALARY_COLUMNS + query.orderBy(PERIOD_SORTABLE, "year") + " LIMIT ? OFFSET ?",
            salaryRowMapper(), query.getPerPage(), query.offset());
    }

    public long countSalaries() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM salaries", Long.class);
        return count != null ? count : 0L;
    }

    public List<Salary> findSalariesByEmployee(long employeeId) {
        return jdbcTemplate.query(SALARY_COLUMNS + " WHERE employee_id = ? ORDER BY year DESC, id DESC",
            salaryRowMapper(), employeeId);
    }

    public long insertSalary(Salary salary) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO salaries (employee_id, year, month, amount, deductions, notes) VALUES (?, ?, ?, ?, ?, ?) " +
            "RETURNING id",
            Long.class,
            salary.getEmployeeId(), salary.getYear(), salary.getMonth(), salary.getAmount(), salary.getDeductions(),
            salary.getNotes());
    }

    public int updateSalary(Salary salary) {
        return jdbcTemplate.update(
            "UPDATE salaries SET employee_id = ?, year = ?, month = ?, amount = ?, deductions = ?, notes = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            salary.getEmployeeId(), salary.getYear(), salary.getMonth(), salary.getAmount(), salary.getDeductions(),
            salary.getNotes(), salary.getId());
    }

    public int deleteSalary(long id) {
        return jdbcTemplate.update("DELETE FROM salaries WHERE id = ?", id);
    }

    // ==================== Deductions ====================

    public Optional<Deduction> findDeduction(long id) {
        return jdbcTemplate.query(DEDUCTION_COLUMNS + " WHERE id = ?", deductionRowMapper(), id).stream().findFirst();
    }

    public List<Deduction> findDeductions(PageQuery query) {
        return jdbcTemplate.query(
            DEDUCTION_COLUMNS + query.orderBy(PERIOD_SORTABLE, "year") + " LIMIT ? OFFSET ?",
            deductionRowMapper(), query.getPerPage(), query.offset());
    }

    public long countDeductions() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM deductions", Long.class);
        return count != null ? count : 0L;
    }

    public List<Deduction> findDeductionsByEmployee(long employeeId) {
        return jdbcTemplate.query(DEDUCTION_COLUMNS + " WHERE employee_id = ? ORDER BY year DESC, id DESC",
            deductionRowMapper(), employeeId);
    }

    public List<Deduction> findDeductionsByPeriod(long employeeId, int year, String month) {
        return jdbcTemplate.query(DEDUCTION_COLUMNS + " WHERE employee_id = ? AND year = ? AND month = ? ORDER BY id",
            deductionRowMapper(), employeeId, year, month);
    }

    /**
     * &Sigma;(amount &times; rate) of the employee's deductions for the period.
     */
    public BigDecimal sumDeductions(long employeeId, int year, String month) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount * rate), 0) FROM deductions WHERE employee_id = ? AND year = ? AND month = ?",
            BigDecimal.class, employeeId, year, month);
    }

    public long insertDeduction(Deduction deduction) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO deductions (employee_id, year, month, currency, rate, amount) VALUES (?, ?, ?, ?, ?, ?) " +
            "RETURNING id",
            Long.class,
            deduction.getEmployeeId(), deduction.getYear(), deduction.getMonth(), deduction.getCurrency(),
            deduction.getRate(), deduction.getAmount());
    }

    public int updateDeduction(Deduction deduction) {
        return jdbcTemplate.update(
            "UPDATE deductions SET employee_id = ?, year = ?, month = ?, currency = ?, rate = ?, amount = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            deduction.getEmployeeId(), deduction.getYear(), deduction.getMonth(), deduction.getCurrency(),
            deduction.getRate(), deduction.getAmount(), deduction.getId());
    }

    public int deleteDeduction(long id) {
        return jdbcTemplate.update("DELETE FROM deductions WHERE id = ?", id);
    }

    private RowMapper<Employee> employeeRowMapper() {
        return (rs, rowNum) -> Employee.builder()
            .id(rs.getLong("id"))
            .fullName(rs.getString("full_name"))
            .phone(rs.getString("phone"))
            .email(rs.getString("email"))
            .address(rs.getString("address"))
            .position(rs.getString("position"))
            .hireDate(rs.getObject("hire_date", LocalDate.class))
            .baseSalary(rs.getBigDecimal("base_salary"))
            .notes(rs.getString("notes"))
            .build();
    }

    private RowMapper<Salary> salaryRowMapper() {
        return (rs, rowNum) -> Salary.builder()
            .id(rs.getLong("id"))
            .employeeId(rs.getLong("employee_id"))
            .year(rs.getInt("year"))
            .month(rs.getString("month"))
            .amount(rs.getBigDecimal("amount"))
            .deductions(rs.getBigDecimal("deductions"))
            .notes(rs.getString("notes"))
            .build();
    }

    private RowMapper<Deduction> deductionRowMapper() {
        return (rs, rowNum) -> Deduction.builder()
            .id(rs.getLong("id"))
            .employeeId(rs.getLong("employee_id"))
            .year(rs.getInt("year"))
            .month(rs.getString("month"))
            .currency(rs.getString("currency"))
            .rate(rs.getBigDecimal("rate"))
            .amount(rs.getBigDecimal("amount"))
            .build();
    }
}
