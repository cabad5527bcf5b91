package com.cashcow.calculator.builtin;

import com.cashcow.calculator.CalculationContext;
import com.cashcow.calculator.CalculatorRegistry;
import com.cashcow.domain.enums.CashFlowCategory;
import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Employee;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Payroll calculators. Only {@code total_cost_calc} feeds the period row; the others are
 * components and compensation figures exposed for reporting.
 */
public final class EmployeeCalculators {

    public static final String SALARY = "salary_calc";
    public static final String OVERHEAD = "overhead_calc";
    public static final String BENEFITS = "benefits_calc";
    public static final String TOTAL_COST = "total_cost_calc";
    public static final String EQUITY = "equity_calc";
    public static final String TOTAL_COMPENSATION = "total_compensation_calc";

    static final String SHARE_PRICE_PARAM = "share_price";
    static final String EQUITY_VALUE_PER_SHARE_PARAM = "equity_value_per_share";

    private static final double DAYS_PER_YEAR = 365.25;

    private EmployeeCalculators() {}

    static void register(CalculatorRegistry registry) {
        registry.register(EntityType.EMPLOYEE, SALARY, Employee.class,
                EmployeeCalculators::salary, "Monthly base salary");
        registry.register(EntityType.EMPLOYEE, OVERHEAD, Employee.class,
                EmployeeCalculators::overhead, "Monthly overhead above base salary",
                null, List.of(SALARY));
        registry.register(EntityType.EMPLOYEE, BENEFITS, Employee.class,
                EmployeeCalculators::benefits, "Monthly benefits and allowances");
        registry.register(EntityType.EMPLOYEE, TOTAL_COST, Employee.class,
                EmployeeCalculators::totalCost, "Fully loaded monthly employee cost",
                CashFlowCategory.EMPLOYEE_COSTS, List.of(SALARY, OVERHEAD, BENEFITS));
        registry.register(EntityType.EMPLOYEE, EQUITY, Employee.class,
                EmployeeCalculators::equity, "Value of equity vesting this month");
        registry.register(EntityType.EMPLOYEE, TOTAL_COMPENSATION, Employee.class,
                EmployeeCalculators::totalCompensation, "Annual compensation including bonus and equity",
                null, List.of(SALARY, EQUITY));
    }

    static double salary(Employee employee, CalculationContext context) {
        if (!employee.isActive(context.getAsOfDate())) {
            return 0.0;
        }
        return employee.monthlySalary();
    }

    static double overhead(Employee employee, CalculationContext context) {
        if (!employee.isActive(context.getAsOfDate())) {
            return 0.0;
        }
        return context.dependencyValue(SALARY) * (employee.overheadMultiplierOrDefault() - 1.0);
    }

    static double benefits(Employee employee, CalculationContext context) {
        if (!employee.isActive(context.getAsOfDate())) {
            return 0.0;
        }
        return employee.monthlyBenefits();
    }

    static double totalCost(Employee employee, CalculationContext context) {
        if (!employee.isActive(context.getAsOfDate())) {
            return 0.0;
        }
        return context.dependencyValue(SALARY) + context.dependencyValue(OVERHEAD) + context.dependencyValue(BENEFITS);
    }

    /**
     * Monthly vesting value at the {@code share_price} parameter. Zero before the cliff and
     * once the grant is fully vested.
     */
    static double equity(Employee employee, CalculationContext context) {
        LocalDate asOf = context.getAsOfDate();
        if (!employee.isActive(asOf) || !employee.isEquityEligible() || employee.getEquityShares() == null) {
            return 0.0;
        }
        double sharePrice = context.numericParameter(SHARE_PRICE_PARAM, 0.0);
        LocalDate equityStart = employee.equityStartOrHireDate();
        if (sharePrice <= 0.0 || equityStart == null) {
            return 0.0;
        }
        double yearsElapsed = ChronoUnit.DAYS.between(equityStart, asOf) / DAYS_PER_YEAR;
        int vestingYears = employee.vestingYearsOrDefault();
        if (yearsElapsed < employee.cliffYearsOrDefault() || yearsElapsed >= vestingYears) {
            return 0.0;
        }
        return employee.getEquityShares() / (double) vestingYears / 12.0 * sharePrice;
    }

    static double totalCompensation(Employee employee, CalculationContext context) {
        if (!employee.isActive(context.getAsOfDate())) {
            return 0.0;
        }
        double annualSalary = context.dependencyValue(SALARY) * 12.0;
        double compensation = annualSalary;
        if (employee.getBonusPerformanceMax() != null && employee.getBonusPerformanceMax() > 0) {
            compensation += annualSalary * employee.getBonusPerformanceMax();
        }
        if (employee.getBonusMilestonesMax() != null && employee.getBonusMilestonesMax() > 0) {
            compensation += annualSalary * employee.getBonusMilestonesMax();
        }
        double valuePerShare = context.numericParameter(EQUITY_VALUE_PER_SHARE_PARAM, 0.0);
        Integer vestYears = employee.getEquityVestYears();
        if (employee.isEquityEligible() && employee.getEquityShares() != null && valuePerShare > 0
                && vestYears != null && vestYears > 0) {
            compensation += employee.getEquityShares() / (double) vestYears * valuePerShare;
        }
        return compensation;
    }
}
